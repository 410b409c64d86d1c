package com.example.ledger.application.port;

import java.util.List;

import com.example.ledger.application.domain.account.event.AccountEvent;

/**
 * 稽核輸出 Port
 */
public interface AuditSinkPort {

	/**
	 * 輸出帳戶的完整事件歷史
	 *
	 * @param accountId 帳戶 ID
	 * @param events    事件日誌的不可變快照，依寫入順序排列
	 */
	void publish(String accountId, List<AccountEvent> events);
}

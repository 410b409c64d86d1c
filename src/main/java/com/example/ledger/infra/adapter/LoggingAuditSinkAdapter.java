package com.example.ledger.infra.adapter;

import java.util.List;

import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.AuditSinkPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 以日誌形式輸出稽核軌跡：每筆事件一行，附帶其在日誌中的位置
 */
@Slf4j
public class LoggingAuditSinkAdapter implements AuditSinkPort {

	@Override
	public void publish(String accountId, List<AccountEvent> events) {
		log.info(">>> [Audit] 帳戶 {} 共 {} 筆事件", accountId, events.size());
		for (int position = 0; position < events.size(); position++) {
			AccountEvent event = events.get(position);
			log.info(">>> [Audit] #{} {} {} {}", position, event.timestamp(), event.getClass().getSimpleName(),
					event);
		}
	}
}

package com.example.ledger.application.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.example.ledger.application.domain.account.aggregate.AccountAggregate;
import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.AuditSinkPort;
import com.example.ledger.infra.repository.AccountRepository;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@AllArgsConstructor
public class AccountQueryService {

	private final AccountRepository accountRepository;
	private final AuditSinkPort auditSink;

	/**
	 * 讀取帳戶目前的快取狀態
	 *
	 * @param accountId 聚合根唯一值
	 * @throws IllegalArgumentException 帳戶不存在
	 */
	public AccountState snapshot(String accountId) {
		return load(accountId).snapshot();
	}

	/**
	 * 帳戶完整事件歷史 (不可變快照)
	 */
	public List<AccountEvent> history(String accountId) {
		return load(accountId).events();
	}

	/**
	 * 將帳戶事件歷史推送至稽核輸出
	 *
	 * @return 匯出的事件筆數
	 */
	public int exportAudit(String accountId) {
		List<AccountEvent> events = history(accountId);
		auditSink.publish(accountId, events);
		log.info(">>> [Audit] 帳戶 {} 匯出 {} 筆事件", accountId, events.size());
		return events.size();
	}

	private AccountAggregate load(String accountId) {
		return accountRepository.find(accountId)
				.orElseThrow(() -> new IllegalArgumentException("帳戶不存在: " + accountId));
	}
}

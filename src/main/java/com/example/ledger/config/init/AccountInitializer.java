package com.example.ledger.config.init;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.service.AccountCommandService;
import com.example.ledger.application.service.AccountQueryService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 示範帳戶初始化 (ledger.demo.enabled=true 時啟用)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.demo", name = "enabled", havingValue = "true")
public class AccountInitializer {

	static final String DEMO_ACCOUNT = "A001";

	private final AccountCommandService commandService;
	private final AccountQueryService queryService;

	@EventListener(ApplicationReadyEvent.class)
	public void init() {
		log.info(">>> [系統初始化] 建立示範帳戶 {}", DEMO_ACCOUNT);

		commandService.createAccount(DEMO_ACCOUNT, "Alice").join();
		commandService.deposit(DEMO_ACCOUNT, 500).join();
		AccountState state = commandService.withdraw(DEMO_ACCOUNT, 120).join();

		log.info(">>> [系統初始化] 示範帳戶 {} 完成，持有人: {}，餘額: {}", DEMO_ACCOUNT, state.getOwner(),
				state.getBalance());
		queryService.exportAudit(DEMO_ACCOUNT);
	}
}

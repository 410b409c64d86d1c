package com.example.ledger.application.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Service;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.command.AccountCommand;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.CommandBusPort;

import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 帳戶指令服務
 *
 * <p>
 * 將業務意圖封裝為 {@link AccountCommand} 並送入單一寫入者管線。本服務不直接操作聚合根，
 * 執行結果 (或失敗原因) 由回傳的 {@link CompletableFuture} 帶回。
 * </p>
 */
@Slf4j
@Service
@AllArgsConstructor
public class AccountCommandService {

	private final CommandBusPort commandBus;

	public CompletableFuture<AccountState> createAccount(String accountId, String owner) {
		log.info(">>> [Command] 開戶: {} - 持有人: {}", accountId, owner);
		return commandBus.dispatch(AccountCommand.create(accountId, owner));
	}

	public CompletableFuture<AccountState> deposit(String accountId, long amount) {
		log.info(">>> [Command] 存款: {} - 金額: {}", accountId, amount);
		return commandBus.dispatch(AccountCommand.deposit(accountId, amount));
	}

	public CompletableFuture<AccountState> withdraw(String accountId, long amount) {
		log.info(">>> [Command] 提款: {} - 金額: {}", accountId, amount);
		return commandBus.dispatch(AccountCommand.withdraw(accountId, amount));
	}

	/**
	 * 要求帳戶由事件日誌重建狀態
	 */
	public CompletableFuture<AccountState> replay(String accountId) {
		log.info(">>> [Command] 重播: {}", accountId);
		return commandBus.dispatch(AccountCommand.replay(accountId));
	}

	/**
	 * 以外部事件歷史取代帳戶目前的聚合根
	 * <p>
	 * 歷史無法重播時 future 以 AggregateConsistencyException 失敗，既有聚合根保持不變。
	 * </p>
	 */
	public CompletableFuture<AccountState> restore(String accountId, List<? extends AccountEvent> history) {
		log.info(">>> [Command] 還原: {} - 歷史事件: {} 筆", accountId, history.size());
		return commandBus.dispatch(AccountCommand.restore(accountId, history));
	}

	/**
	 * 自倉儲移除帳戶，完成後回傳空狀態
	 */
	public CompletableFuture<AccountState> evict(String accountId) {
		log.info(">>> [Command] 移除: {}", accountId);
		return commandBus.dispatch(AccountCommand.evict(accountId));
	}
}

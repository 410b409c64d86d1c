package com.example.ledger.application.domain.account.command;

import java.util.List;

import com.example.ledger.application.domain.account.aggregate.vo.CommandType;
import com.example.ledger.application.domain.account.event.AccountEvent;

import lombok.Builder;
import lombok.Value;

/**
 * 帳戶指令 (Internal Command Object)
 *
 * <p>
 * 代表一個明確的業務意圖，經由指令匯流排送入單一寫入者管線後，才會在聚合根上執行。
 * </p>
 */
@Value
@Builder
public class AccountCommand {

	/**
	 * 目標帳戶 ID
	 */
	String accountId;

	/**
	 * 指令類型
	 */
	CommandType type;

	/**
	 * 帳戶持有人 (僅 CREATE 使用)
	 */
	String owner;

	/**
	 * 金額 (僅 DEPOSIT / WITHDRAW 使用)
	 */
	long amount;

	/**
	 * 事件歷史 (僅 RESTORE 使用)
	 */
	List<AccountEvent> history;

	public static AccountCommand create(String accountId, String owner) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.CREATE).owner(owner).build();
	}

	public static AccountCommand deposit(String accountId, long amount) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.DEPOSIT).amount(amount).build();
	}

	public static AccountCommand withdraw(String accountId, long amount) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.WITHDRAW).amount(amount).build();
	}

	public static AccountCommand replay(String accountId) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.REPLAY).build();
	}

	public static AccountCommand restore(String accountId, List<? extends AccountEvent> history) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.RESTORE).history(List.copyOf(history))
				.build();
	}

	public static AccountCommand evict(String accountId) {
		return AccountCommand.builder().accountId(accountId).type(CommandType.EVICT).build();
	}
}

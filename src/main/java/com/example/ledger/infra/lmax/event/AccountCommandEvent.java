package com.example.ledger.infra.lmax.event;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.aggregate.vo.CommandType;
import com.example.ledger.application.domain.account.command.AccountCommand;
import com.example.ledger.application.domain.account.event.AccountEvent;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 作為 Disruptor RingBuffer 的指令載體
 *
 * <p>
 * RingBuffer 槽位會被重複使用，消費完畢後必須呼叫 {@link #clear()}。
 * </p>
 */
@Data
@NoArgsConstructor
public class AccountCommandEvent {

	private String accountId;

	private CommandType type;

	private String owner;

	private long amount;

	private List<AccountEvent> history;

	/**
	 * 指令結果，由消費者完成
	 */
	private CompletableFuture<AccountState> result;

	public void load(AccountCommand command, CompletableFuture<AccountState> result) {
		this.accountId = command.getAccountId();
		this.type = command.getType();
		this.owner = command.getOwner();
		this.amount = command.getAmount();
		this.history = command.getHistory();
		this.result = result;
	}

	public void clear() {
		this.accountId = null;
		this.type = null;
		this.owner = null;
		this.amount = 0L;
		this.history = null;
		this.result = null;
	}
}

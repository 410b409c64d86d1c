package com.example.ledger.application.domain.account.event;

import java.time.Instant;
import java.util.Objects;

/**
 * 存款事件
 *
 * @param id        事件 ID
 * @param timestamp 發生時間
 * @param amount    存入金額 (必須為正數)
 */
public record FundsDeposited(String id, Instant timestamp, long amount) implements AccountEvent {

	public FundsDeposited {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		if (amount <= 0) {
			throw new IllegalArgumentException("存款金額必須為正數: " + amount);
		}
	}

	@Override
	public <R> R accept(AccountEventVisitor<R> visitor) {
		return visitor.onFundsDeposited(this);
	}
}

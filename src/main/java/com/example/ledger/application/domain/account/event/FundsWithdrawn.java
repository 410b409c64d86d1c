package com.example.ledger.application.domain.account.event;

import java.time.Instant;
import java.util.Objects;

/**
 * 提款事件
 *
 * @param id        事件 ID
 * @param timestamp 發生時間
 * @param amount    提領金額 (必須為正數)
 */
public record FundsWithdrawn(String id, Instant timestamp, long amount) implements AccountEvent {

	public FundsWithdrawn {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		if (amount <= 0) {
			throw new IllegalArgumentException("提款金額必須為正數: " + amount);
		}
	}

	@Override
	public <R> R accept(AccountEventVisitor<R> visitor) {
		return visitor.onFundsWithdrawn(this);
	}
}

package com.example.ledger.application.domain.account.event;

import java.time.Instant;
import java.util.Objects;

/**
 * 開戶事件
 *
 * @param id        事件 ID
 * @param timestamp 發生時間
 * @param owner     帳戶持有人
 */
public record AccountCreated(String id, Instant timestamp, String owner) implements AccountEvent {

	public AccountCreated {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		Objects.requireNonNull(owner, "owner");
	}

	@Override
	public <R> R accept(AccountEventVisitor<R> visitor) {
		return visitor.onAccountCreated(this);
	}
}

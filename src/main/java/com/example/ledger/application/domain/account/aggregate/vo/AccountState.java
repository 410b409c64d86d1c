package com.example.ledger.application.domain.account.aggregate.vo;

import lombok.Value;

/**
 * 帳戶狀態 (Materialized View)
 *
 * <p>
 * 不可變值物件：每次套用事件都產生新的實例，舊的參照永遠是有效的歷史快照。
 * </p>
 *
 * <ul>
 * <li>{@code balance >= 0}</li>
 * <li>{@code active == false} 時 {@code balance == 0} 且 {@code owner} 為空字串</li>
 * </ul>
 */
@Value
public class AccountState {

	private static final AccountState EMPTY = new AccountState("", 0L, false);

	/**
	 * 帳戶持有人
	 */
	String owner;

	/**
	 * 目前餘額
	 */
	long balance;

	/**
	 * 是否已開戶
	 */
	boolean active;

	/**
	 * @throws IllegalArgumentException 狀態違反 {@code balance >= 0} 或「未開戶時餘額為 0」
	 */
	public AccountState(String owner, long balance, boolean active) {
		if (owner == null) {
			throw new IllegalArgumentException("帳戶持有人不可為 null");
		}
		if (balance < 0) {
			throw new IllegalArgumentException("餘額不可為負數: " + balance);
		}
		if (!active && balance != 0) {
			throw new IllegalArgumentException("未開戶的帳戶餘額必須為 0: " + balance);
		}
		this.owner = owner;
		this.balance = balance;
		this.active = active;
	}

	/**
	 * 初始 (尚未開戶) 狀態
	 */
	public static AccountState empty() {
		return EMPTY;
	}

	/**
	 * 剛開戶的狀態：餘額為 0
	 */
	public static AccountState opened(String owner) {
		return new AccountState(owner, 0L, true);
	}

	public AccountState credit(long amount) {
		return new AccountState(owner, Math.addExact(balance, amount), active);
	}

	public AccountState debit(long amount) {
		return new AccountState(owner, balance - amount, active);
	}
}

package com.example.ledger.application.domain.account.exception;

import lombok.Getter;

/**
 * 聚合根一致性錯誤 (致命)
 *
 * <p>
 * 重播時若歷史事件無法被目前的狀態轉移函式接受，代表事件日誌損毀或轉移規則與歷史不相容。
 * 發生後聚合根被標記為不一致，直到下一次重播成功前，所有讀寫操作都會拋出此例外。
 * </p>
 */
@Getter
public class AggregateConsistencyException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final String accountId;

	/**
	 * 無法套用的事件在日誌中的位置 (0-based)，未知時為 -1
	 */
	private final long position;

	public AggregateConsistencyException(String accountId, long position, String message, Throwable cause) {
		super(message, cause);
		this.accountId = accountId;
		this.position = position;
	}

	public AggregateConsistencyException(String accountId, String message) {
		this(accountId, -1, message, null);
	}
}

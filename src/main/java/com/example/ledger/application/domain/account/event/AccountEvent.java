package com.example.ledger.application.domain.account.event;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 帳戶領域事件 (Domain Event)
 *
 * <p>
 * 事件是「已經發生的事實」，一旦建立即不可變更。帳戶狀態永遠不直接儲存，而是由事件流依序折疊 (fold) 推導而來。
 * </p>
 *
 * <p>
 * 事件種類為封閉集合：{@link AccountCreated}、{@link FundsDeposited}、{@link FundsWithdrawn}。
 * 新增事件種類時必須同步擴充 {@link AccountEventVisitor}，否則狀態轉移函式將無法編譯。
 * </p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = AccountCreated.class, name = "AccountCreated"),
		@JsonSubTypes.Type(value = FundsDeposited.class, name = "FundsDeposited"),
		@JsonSubTypes.Type(value = FundsWithdrawn.class, name = "FundsWithdrawn") })
public sealed interface AccountEvent permits AccountCreated, FundsDeposited, FundsWithdrawn {

	/**
	 * 事件唯一識別碼 (由 IdGenerator 於建立時指派)
	 */
	String id();

	/**
	 * 事件發生時間 (由 Clock 於建立時指派)
	 */
	Instant timestamp();

	/**
	 * 依事件種類分派至對應的處理方法
	 *
	 * @param visitor 事件訪問者
	 * @return 訪問者的處理結果
	 */
	<R> R accept(AccountEventVisitor<R> visitor);
}

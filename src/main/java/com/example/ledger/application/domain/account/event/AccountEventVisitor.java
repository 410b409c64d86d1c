package com.example.ledger.application.domain.account.event;

/**
 * 帳戶事件訪問者
 *
 * <p>
 * 每一種事件對應一個方法。實作者必須處理全部事件種類，新增事件時編譯器會強制所有實作補上對應分支。
 * </p>
 *
 * @param <R> 處理結果型別
 */
public interface AccountEventVisitor<R> {

	R onAccountCreated(AccountCreated event);

	R onFundsDeposited(FundsDeposited event);

	R onFundsWithdrawn(FundsWithdrawn event);
}

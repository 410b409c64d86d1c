package com.example.ledger.application.domain.account.aggregate;

import java.util.List;
import java.util.Objects;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.aggregate.vo.ViolationType;
import com.example.ledger.application.domain.account.event.AccountCreated;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.domain.account.event.AccountEventVisitor;
import com.example.ledger.application.domain.account.event.FundsDeposited;
import com.example.ledger.application.domain.account.event.FundsWithdrawn;
import com.example.ledger.application.domain.account.exception.InvariantViolationException;

/**
 * 帳戶狀態轉移函式 {@code (AccountState, AccountEvent) -> AccountState}
 *
 * <p>
 * 純函式：無副作用、相同輸入必得相同輸出。聚合根的快取狀態與重播結果都只經由此處產生，
 * 因此「狀態 = 事件歷史的折疊結果」得以成立。
 * </p>
 *
 * <pre>
 * AccountCreated  : 已開戶 -> ALREADY_ACTIVE；否則 {owner, 0, true}
 * FundsDeposited  : 未開戶 -> INACTIVE_ACCOUNT；否則 balance + amount
 * FundsWithdrawn  : 未開戶 -> INACTIVE_ACCOUNT；amount > balance -> INSUFFICIENT_FUNDS；否則 balance - amount
 * </pre>
 */
public final class AccountStateTransition {

	private AccountStateTransition() {
	}

	/**
	 * 將單一事件套用至狀態
	 *
	 * @param state 目前狀態
	 * @param event 欲套用的事件
	 * @return 新狀態 (原狀態不會被修改)
	 * @throws InvariantViolationException 事件違反業務不變量
	 */
	public static AccountState apply(AccountState state, AccountEvent event) {
		Objects.requireNonNull(state, "state");
		Objects.requireNonNull(event, "event");

		return event.accept(new AccountEventVisitor<>() {

			@Override
			public AccountState onAccountCreated(AccountCreated created) {
				if (state.isActive()) {
					throw new InvariantViolationException(ViolationType.ALREADY_ACTIVE,
							"帳戶已由 " + state.getOwner() + " 開立，不可重複開戶");
				}
				return AccountState.opened(created.owner());
			}

			@Override
			public AccountState onFundsDeposited(FundsDeposited deposited) {
				requireActive(state);
				return state.credit(deposited.amount());
			}

			@Override
			public AccountState onFundsWithdrawn(FundsWithdrawn withdrawn) {
				requireActive(state);
				// 提領金額等於餘額是允許的
				if (withdrawn.amount() > state.getBalance()) {
					throw new InvariantViolationException(ViolationType.INSUFFICIENT_FUNDS,
							"餘額不足！目前餘額: " + state.getBalance() + "，欲提領: " + withdrawn.amount());
				}
				return state.debit(withdrawn.amount());
			}
		});
	}

	/**
	 * 依序折疊事件流
	 *
	 * @param initial 起始狀態
	 * @param events  依寫入順序排列的事件
	 * @return 折疊後的最終狀態
	 * @throws InvariantViolationException 任一事件無法套用
	 */
	public static AccountState fold(AccountState initial, List<? extends AccountEvent> events) {
		AccountState state = initial;
		for (AccountEvent event : events) {
			state = apply(state, event);
		}
		return state;
	}

	private static void requireActive(AccountState state) {
		if (!state.isActive()) {
			throw new InvariantViolationException(ViolationType.INACTIVE_ACCOUNT, "帳戶尚未開立");
		}
	}
}

package com.example.ledger.application.domain.account.aggregate;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.event.AccountCreated;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.domain.account.event.FundsDeposited;
import com.example.ledger.application.domain.account.event.FundsWithdrawn;
import com.example.ledger.application.domain.account.exception.AggregateConsistencyException;
import com.example.ledger.application.domain.account.exception.InvariantViolationException;
import com.example.ledger.application.domain.account.journal.AccountEventLog;
import com.example.ledger.application.port.ClockPort;
import com.example.ledger.application.port.IdGeneratorPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 帳戶聚合根 (Event-Sourced Aggregate Root)
 *
 * <p>
 * 綁定一份 {@link AccountEventLog} 與一份快取狀態。所有寫入操作遵循「先驗證、後追加」協議：
 * </p>
 *
 * <pre>
 * 1. 以意圖參數加上注入的 id / timestamp 建立候選事件
 * 2. newState = transition(cachedState, event)，失敗則原樣拋出，不追加、不改狀態
 * 3. 成功則追加事件，再將快取狀態替換為 newState
 * </pre>
 *
 * <p>
 * 併發模型：同一聚合根的所有寫入操作 (create / deposit / withdraw / replay) 由同一把鎖序列化；
 * {@link #snapshot()} 不取鎖，透過 volatile 指標讀到操作前或操作後的完整狀態，不會讀到中間態。
 * 不同帳戶的聚合根彼此獨立。
 * </p>
 *
 * <p>
 * 任何觀察點上皆成立：{@code snapshot() == fold(transition, empty(), events())}。
 * </p>
 */
@Slf4j
public class AccountAggregate {

	private final String accountId;
	private final AccountEventLog eventLog;
	private final IdGeneratorPort idGenerator;
	private final ClockPort clock;
	private final ReentrantLock writeLock = new ReentrantLock();

	/**
	 * 快取狀態；null 代表重播失敗後的「不一致」標記
	 */
	private volatile AccountState state;

	public AccountAggregate(String accountId, IdGeneratorPort idGenerator, ClockPort clock) {
		this(accountId, new AccountEventLog(), idGenerator, clock);
	}

	/**
	 * 綁定既有日誌，並立即由日誌折疊出快取狀態
	 *
	 * @throws AggregateConsistencyException 日誌中的事件無法被套用
	 */
	AccountAggregate(String accountId, AccountEventLog eventLog, IdGeneratorPort idGenerator, ClockPort clock) {
		this.accountId = Objects.requireNonNull(accountId, "accountId");
		this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
		this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
		this.clock = Objects.requireNonNull(clock, "clock");
		this.state = rebuild(eventLog.all());
	}

	/**
	 * 由既有事件歷史重建聚合根
	 *
	 * @throws AggregateConsistencyException 歷史事件無法被套用
	 */
	public static AccountAggregate fromHistory(String accountId, List<? extends AccountEvent> history,
			IdGeneratorPort idGenerator, ClockPort clock) {
		return new AccountAggregate(accountId, new AccountEventLog(history), idGenerator, clock);
	}

	/**
	 * 開戶
	 *
	 * @param owner 帳戶持有人，不可為空白
	 * @return 開戶後的狀態
	 * @throws IllegalArgumentException    owner 為 null 或空白
	 * @throws InvariantViolationException 帳戶已開立 (ALREADY_ACTIVE)
	 */
	public AccountState create(String owner) {
		if (owner == null || owner.isBlank()) {
			throw new IllegalArgumentException("帳戶持有人不可為空白");
		}
		return execute(() -> new AccountCreated(idGenerator.next(), clock.now(), owner));
	}

	/**
	 * 存款
	 *
	 * @throws IllegalArgumentException    金額非正數
	 * @throws InvariantViolationException 帳戶未開立 (INACTIVE_ACCOUNT)
	 */
	public AccountState deposit(long amount) {
		requirePositive(amount);
		return execute(() -> new FundsDeposited(idGenerator.next(), clock.now(), amount));
	}

	/**
	 * 提款
	 *
	 * @throws IllegalArgumentException    金額非正數
	 * @throws InvariantViolationException 帳戶未開立 (INACTIVE_ACCOUNT) 或餘額不足 (INSUFFICIENT_FUNDS)
	 */
	public AccountState withdraw(long amount) {
		requirePositive(amount);
		return execute(() -> new FundsWithdrawn(idGenerator.next(), clock.now(), amount));
	}

	/**
	 * 捨棄快取，從初始狀態依序折疊整份事件日誌
	 *
	 * <p>
	 * 連續呼叫 (中間無追加) 結果相同。若任一歷史事件無法套用，聚合根被標記為不一致並拋出
	 * {@link AggregateConsistencyException}。
	 * </p>
	 *
	 * @return 重建後的狀態
	 */
	public AccountState replay() {
		writeLock.lock();
		try {
			List<AccountEvent> history = eventLog.all();
			AccountState rebuilt;
			try {
				rebuilt = rebuild(history);
			} catch (AggregateConsistencyException e) {
				state = null;
				throw e;
			}
			state = rebuilt;
			log.info(">>> [Replay] 帳戶 {} 重播 {} 筆事件完成，餘額: {}", accountId, history.size(), rebuilt.getBalance());
			return rebuilt;
		} finally {
			writeLock.unlock();
		}
	}

	/**
	 * 目前快取狀態 (不重新計算)
	 *
	 * @throws AggregateConsistencyException 上一次重播失敗，狀態未知
	 */
	public AccountState snapshot() {
		AccountState current = state;
		if (current == null) {
			throw inconsistent();
		}
		return current;
	}

	/**
	 * 事件日誌的唯讀快照，供稽核使用
	 */
	public List<AccountEvent> events() {
		return eventLog.all();
	}

	/**
	 * 目前版本 = 已寫入的事件數
	 */
	public long version() {
		return eventLog.size();
	}

	public String accountId() {
		return accountId;
	}

	private AccountState execute(Supplier<AccountEvent> eventFactory) {
		writeLock.lock();
		try {
			AccountState current = state;
			if (current == null) {
				throw inconsistent();
			}

			AccountEvent event = eventFactory.get();
			AccountState next;
			try {
				next = AccountStateTransition.apply(current, event);
			} catch (InvariantViolationException e) {
				log.warn(">>> [Aggregate] 帳戶 {} 拒絕事件 {}: {}", accountId, event.getClass().getSimpleName(),
						e.getViolationType());
				throw e;
			}

			// 追加與狀態替換必須在同一把鎖內完成
			eventLog.append(event);
			state = next;

			log.debug(">>> [Aggregate] 帳戶 {} 套用 {} 成功 (Version: {})，目前餘額: {}", accountId,
					event.getClass().getSimpleName(), eventLog.size(), next.getBalance());
			return next;
		} finally {
			writeLock.unlock();
		}
	}

	private AccountState rebuild(List<AccountEvent> history) {
		AccountState rebuilt = AccountState.empty();
		for (int position = 0; position < history.size(); position++) {
			AccountEvent event = history.get(position);
			try {
				rebuilt = AccountStateTransition.apply(rebuilt, event);
			} catch (InvariantViolationException e) {
				log.error(">>> [Replay] 帳戶 {} 第 {} 筆事件 ({}) 無法套用，聚合根已標記為不一致: {}", accountId, position, event.id(),
						e.getMessage());
				throw new AggregateConsistencyException(accountId, position,
						"帳戶 " + accountId + " 事件日誌第 " + position + " 筆無法重播: " + e.getViolationType(), e);
			}
		}
		return rebuilt;
	}

	private AggregateConsistencyException inconsistent() {
		return new AggregateConsistencyException(accountId, "帳戶 " + accountId + " 處於不一致狀態，必須重播成功後才能繼續操作");
	}

	private static void requirePositive(long amount) {
		if (amount <= 0) {
			throw new IllegalArgumentException("金額必須為正數: " + amount);
		}
	}
}

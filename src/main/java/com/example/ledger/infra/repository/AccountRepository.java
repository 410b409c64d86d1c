package com.example.ledger.infra.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.example.ledger.application.domain.account.aggregate.AccountAggregate;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.ClockPort;
import com.example.ledger.application.port.IdGeneratorPort;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 帳戶聚合根倉儲 (In-Memory Registry)
 * <p>
 * 每個帳戶 ID 對應唯一一個聚合根實例。各聚合根各自持有鎖，不同帳戶之間不需要任何協調。
 * </p>
 *
 * <pre>
 * 1. 讀取 ({@link #find}) 可由任何執行緒進行。
 * 2. 變更登錄內容 ({@link #save} / {@link #restore} / {@link #evict}) 只能在指令處理器 (單一寫入者) 執行緒上進行，
 *    否則處理器手上的聚合根可能在確認寫入後被替換掉。
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountRepository {

	private final Map<String, AccountAggregate> aggregates = new ConcurrentHashMap<>();
	private final IdGeneratorPort idGenerator;
	private final ClockPort clock;

	/**
	 * 建立一個尚未登錄的空聚合根，成功開戶後再以 {@link #save} 登錄
	 *
	 * @param accountId 帳戶唯一值
	 */
	public AccountAggregate newAggregate(String accountId) {
		requireAccountId(accountId);
		return new AccountAggregate(accountId, idGenerator, clock);
	}

	public Optional<AccountAggregate> find(String accountId) {
		requireAccountId(accountId);
		return Optional.ofNullable(aggregates.get(accountId));
	}

	/**
	 * 登錄聚合根；同 ID 已登錄時保留既有實例
	 *
	 * @return 登錄中的聚合根
	 */
	public AccountAggregate save(AccountAggregate aggregate) {
		AccountAggregate registered = aggregates.putIfAbsent(aggregate.accountId(), aggregate);
		if (registered != null) {
			return registered;
		}
		log.info(">>> [Repository] 登錄帳戶聚合根: {}", aggregate.accountId());
		return aggregate;
	}

	/**
	 * 以既有事件歷史重建聚合根並登錄，會取代同 ID 的既有聚合根
	 * <p>
	 * 歷史無法重播時拋出 AggregateConsistencyException，且不會登錄任何聚合根。
	 * </p>
	 */
	public AccountAggregate restore(String accountId, List<? extends AccountEvent> history) {
		requireAccountId(accountId);
		AccountAggregate aggregate = AccountAggregate.fromHistory(accountId, history, idGenerator, clock);
		aggregates.put(accountId, aggregate);
		log.info(">>> [Repository] 帳戶 {} 已由 {} 筆歷史事件重建", accountId, history.size());
		return aggregate;
	}

	/**
	 * 從倉儲移除帳戶
	 *
	 * @return 被移除的聚合根
	 */
	public Optional<AccountAggregate> evict(String accountId) {
		requireAccountId(accountId);
		AccountAggregate removed = aggregates.remove(accountId);
		if (removed != null) {
			log.info(">>> [Repository] 已移除帳戶 {}", accountId);
		}
		return Optional.ofNullable(removed);
	}

	private static void requireAccountId(String accountId) {
		if (accountId == null || accountId.isBlank()) {
			throw new IllegalArgumentException("帳戶 ID 不可為空白");
		}
	}
}

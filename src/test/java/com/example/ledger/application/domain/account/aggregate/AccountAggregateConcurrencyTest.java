package com.example.ledger.application.domain.account.aggregate;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.exception.InvariantViolationException;
import com.example.ledger.infra.adapter.UuidIdGeneratorAdapter;
import com.example.ledger.support.FixedClock;

/**
 * 多執行緒同時操作同一聚合根時，寫入操作必須被序列化
 */
class AccountAggregateConcurrencyTest {

	private static final int THREADS = 8;
	private static final int OPERATIONS_PER_THREAD = 500;

	@Test
	@DisplayName("併發存提款後：餘額非負、日誌筆數等於成功次數、快取等於重播結果")
	void concurrentOperationsStayConsistent() throws Exception {
		AccountAggregate aggregate = new AccountAggregate("ACC-C", new UuidIdGeneratorAdapter(), new FixedClock());
		aggregate.create("Alice");

		AtomicInteger succeeded = new AtomicInteger(1);
		AtomicInteger rejected = new AtomicInteger();
		CountDownLatch start = new CountDownLatch(1);
		ExecutorService executor = Executors.newFixedThreadPool(THREADS);
		List<Future<?>> futures = new ArrayList<>();

		for (int t = 0; t < THREADS; t++) {
			boolean depositor = t % 2 == 0;
			futures.add(executor.submit(() -> {
				start.await();
				for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
					try {
						AccountState state = depositor ? aggregate.deposit(3) : aggregate.withdraw(5);
						assertThat(state.getBalance()).isNotNegative();
						succeeded.incrementAndGet();
					} catch (InvariantViolationException e) {
						rejected.incrementAndGet();
					}
					// 讀取端只會看到完整狀態
					assertThat(aggregate.snapshot().getBalance()).isNotNegative();
				}
				return null;
			}));
		}

		start.countDown();
		for (Future<?> future : futures) {
			future.get(30, TimeUnit.SECONDS);
		}
		executor.shutdown();

		assertThat(succeeded.get() + rejected.get() - 1).isEqualTo(THREADS * OPERATIONS_PER_THREAD);
		assertThat(aggregate.events()).hasSize(succeeded.get());

		AccountState cached = aggregate.snapshot();
		assertThat(cached.getBalance()).isNotNegative();
		assertThat(AccountStateTransition.fold(AccountState.empty(), aggregate.events())).isEqualTo(cached);
		assertThat(aggregate.replay()).isEqualTo(cached);
	}
}

package com.example.ledger.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.ledger.application.domain.account.aggregate.AccountAggregate;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.AuditSinkPort;
import com.example.ledger.infra.repository.AccountRepository;
import com.example.ledger.support.FixedClock;
import com.example.ledger.support.SequentialIdGenerator;

class AccountQueryServiceTest {

	private final List<AccountEvent> published = new ArrayList<>();
	private AccountRepository repository;
	private AccountQueryService queryService;

	@BeforeEach
	void setUp() {
		repository = new AccountRepository(new SequentialIdGenerator(), new FixedClock());
		AuditSinkPort recordingSink = (accountId, events) -> published.addAll(events);
		queryService = new AccountQueryService(repository, recordingSink);
	}

	@Test
	@DisplayName("稽核匯出推送完整歷史，且不影響帳戶狀態")
	void exportAuditPublishesFullHistory() {
		AccountAggregate aggregate = repository.save(repository.newAggregate("A001"));
		aggregate.create("Alice");
		aggregate.deposit(500);

		int exported = queryService.exportAudit("A001");

		assertThat(exported).isEqualTo(2);
		assertThat(published).containsExactlyElementsOf(aggregate.events());
		assertThat(queryService.snapshot("A001").getBalance()).isEqualTo(500L);
		assertThat(aggregate.version()).isEqualTo(2L);
	}

	@Test
	@DisplayName("回傳的事件歷史無法被外部修改")
	void historyIsImmutableCopy() {
		repository.save(repository.newAggregate("A001")).create("Alice");

		List<AccountEvent> history = queryService.history("A001");

		assertThatThrownBy(() -> history.clear()).isInstanceOf(UnsupportedOperationException.class);
		assertThat(queryService.history("A001")).hasSize(1);
	}

	@Test
	@DisplayName("查詢不存在的帳戶視為使用錯誤")
	void unknownAccountIsRejected() {
		assertThatThrownBy(() -> queryService.snapshot("NOPE")).isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("NOPE");
		assertThatThrownBy(() -> queryService.exportAudit("NOPE")).isInstanceOf(IllegalArgumentException.class);
		assertThat(published).isEmpty();
	}
}

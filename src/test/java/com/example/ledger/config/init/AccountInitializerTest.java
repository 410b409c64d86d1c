package com.example.ledger.config.init;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.port.AuditSinkPort;
import com.example.ledger.application.service.AccountQueryService;
import com.example.ledger.infra.adapter.JsonAuditSinkAdapter;

@SpringBootTest(properties = { "ledger.demo.enabled=true", "ledger.audit.format=JSON" })
class AccountInitializerTest {

	@Autowired
	private AccountQueryService queryService;

	@Autowired
	private AuditSinkPort auditSink;

	@Test
	@DisplayName("啟用示範模式時，啟動後即存在示範帳戶")
	void demoAccountIsSeededOnStartup() {
		assertThat(auditSink).isInstanceOf(JsonAuditSinkAdapter.class);
		assertThat(queryService.snapshot(AccountInitializer.DEMO_ACCOUNT))
				.isEqualTo(new AccountState("Alice", 380L, true));
		assertThat(queryService.history(AccountInitializer.DEMO_ACCOUNT)).hasSize(3);
	}
}

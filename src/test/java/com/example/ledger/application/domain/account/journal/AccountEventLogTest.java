package com.example.ledger.application.domain.account.journal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.ledger.application.domain.account.event.AccountCreated;
import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.domain.account.event.FundsDeposited;
import com.example.ledger.application.domain.account.event.FundsWithdrawn;

class AccountEventLogTest {

	private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

	@Test
	@DisplayName("事件依追加順序讀出，且日誌不做任何業務驗證")
	void appendKeepsOrderWithoutValidation() {
		AccountEventLog log = new AccountEventLog();
		// 未開戶即提款：日誌本身不拒絕
		FundsWithdrawn first = new FundsWithdrawn("e1", T0, 10);
		AccountCreated second = new AccountCreated("e2", T0, "Alice");

		log.append(first);
		log.append(second);

		assertThat(log.all()).containsExactly(first, second);
		assertThat(log.size()).isEqualTo(2);
	}

	@Test
	@DisplayName("all() 回傳的快照為唯讀，且不受之後的追加影響")
	void allReturnsDetachedReadOnlySnapshot() {
		AccountEventLog log = new AccountEventLog();
		log.append(new AccountCreated("e1", T0, "Alice"));

		List<AccountEvent> snapshot = log.all();
		log.append(new FundsDeposited("e2", T0, 5));

		assertThat(snapshot).hasSize(1);
		assertThatThrownBy(() -> snapshot.add(new FundsDeposited("e3", T0, 1)))
				.isInstanceOf(UnsupportedOperationException.class);
		assertThat(log.size()).isEqualTo(2);
	}

	@Test
	@DisplayName("以既有歷史建立的日誌與來源清單脫鉤")
	void prePopulatedLogCopiesHistory() {
		List<AccountEvent> history = new ArrayList<>();
		history.add(new AccountCreated("e1", T0, "Alice"));

		AccountEventLog log = new AccountEventLog(history);
		history.add(new FundsDeposited("e2", T0, 5));

		assertThat(log.all()).hasSize(1);
	}
}

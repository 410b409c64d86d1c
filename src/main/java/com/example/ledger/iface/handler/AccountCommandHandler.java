package com.example.ledger.iface.handler;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Component;

import com.example.ledger.application.domain.account.aggregate.AccountAggregate;
import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.infra.lmax.event.AccountCommandEvent;
import com.example.ledger.infra.repository.AccountRepository;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 帳戶指令處理器 (Single Writer)
 *
 * <p>
 * Disruptor 唯一的消費者：依 RingBuffer 序號順序，將指令套用到對應的聚合根，並以結果完成指令的
 * {@link CompletableFuture}。業務失敗不會中斷管線，而是以原始例外異常完成 future 交還呼叫端。
 * 倉儲登錄內容的變更 (開戶登錄、RESTORE、EVICT) 也只在此執行緒上發生。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountCommandHandler implements EventHandler<AccountCommandEvent> {

	private final AccountRepository accountRepository;

	@Override
	public void onEvent(AccountCommandEvent event, long sequence, boolean endOfBatch) {
		CompletableFuture<AccountState> result = event.getResult();
		try {
			AccountState state = execute(event);
			log.debug("[Seq: {}] {} {} 成功，目前餘額: {}", sequence, event.getType(), event.getAccountId(),
					state.getBalance());
			result.complete(state);
		} catch (RuntimeException e) {
			log.warn("[Seq: {}] {} {} 失敗: {}", sequence, event.getType(), event.getAccountId(), e.getMessage());
			result.completeExceptionally(e);
		} finally {
			event.clear();
		}
	}

	private AccountState execute(AccountCommandEvent event) {
		if (event.getType() == null) {
			throw new IllegalArgumentException("指令類型不可為空");
		}
		String accountId = event.getAccountId();
		return switch (event.getType()) {
		case CREATE -> create(accountId, event.getOwner());
		case DEPOSIT -> load(accountId).deposit(event.getAmount());
		case WITHDRAW -> load(accountId).withdraw(event.getAmount());
		case REPLAY -> load(accountId).replay();
		case RESTORE -> accountRepository.restore(accountId, event.getHistory()).snapshot();
		case EVICT -> {
			accountRepository.evict(accountId);
			yield AccountState.empty();
		}
		};
	}

	/**
	 * 開戶：新帳戶只有在開戶成功後才登錄，失敗的開戶不會在倉儲留下空的聚合根
	 */
	private AccountState create(String accountId, String owner) {
		Optional<AccountAggregate> existing = accountRepository.find(accountId);
		if (existing.isPresent()) {
			return existing.get().create(owner);
		}
		AccountAggregate aggregate = accountRepository.newAggregate(accountId);
		AccountState state = aggregate.create(owner);
		accountRepository.save(aggregate);
		return state;
	}

	private AccountAggregate load(String accountId) {
		return accountRepository.find(accountId)
				.orElseThrow(() -> new IllegalArgumentException("帳戶不存在: " + accountId));
	}
}

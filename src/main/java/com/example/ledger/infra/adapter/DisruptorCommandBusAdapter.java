package com.example.ledger.infra.adapter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import org.springframework.stereotype.Component;

import com.example.ledger.application.domain.account.aggregate.vo.AccountState;
import com.example.ledger.application.domain.account.command.AccountCommand;
import com.example.ledger.application.port.CommandBusPort;
import com.example.ledger.infra.lmax.event.AccountCommandEvent;
import com.lmax.disruptor.RingBuffer;

import lombok.AllArgsConstructor;

@Component
@AllArgsConstructor
public class DisruptorCommandBusAdapter implements CommandBusPort {

	private final RingBuffer<AccountCommandEvent> ringBuffer;

	@Override
	public CompletableFuture<AccountState> dispatch(AccountCommand command) {
		Objects.requireNonNull(command, "command");
		CompletableFuture<AccountState> result = new CompletableFuture<>();

		long sequence = ringBuffer.next();
		try {
			ringBuffer.get(sequence).load(command, result);
		} finally {
			ringBuffer.publish(sequence);
		}
		return result;
	}
}

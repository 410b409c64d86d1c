package com.example.ledger.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.ledger.config.properties.LedgerProperties;
import com.example.ledger.iface.handler.AccountCommandHandler;
import com.example.ledger.infra.lmax.event.AccountCommandEvent;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * LMAX Disruptor 設定類 (Account Command Side)
 *
 * <p>
 * 所有會改變帳戶狀態的指令都必須先進入此 Disruptor，由單一消費者 {@link AccountCommandHandler}
 * 依序執行 (Single Writer Principle)。Disruptor 本身不包含業務邏輯，只負責指令傳遞與調度。
 * </p>
 */
@Configuration
public class DisruptorConfiguration {

	/**
	 * 建立 Account 專用的 Disruptor 實例，容器關閉時會等待已發布的指令處理完畢
	 */
	@Bean(destroyMethod = "shutdown")
	public Disruptor<AccountCommandEvent> accountDisruptor(AccountCommandHandler commandHandler,
			LedgerProperties properties) {
		// RingBuffer 容量需為 2 的次方
		Disruptor<AccountCommandEvent> disruptor = new Disruptor<>(AccountCommandEvent::new,
				properties.getRingBufferSize(), DaemonThreadFactory.INSTANCE);
		disruptor.handleEventsWith(commandHandler);
		disruptor.start();
		return disruptor;
	}

	/**
	 * 將 RingBuffer 暴露為 Spring Bean，作為 Command Side 的唯一指令入口
	 */
	@Bean
	public RingBuffer<AccountCommandEvent> ringBuffer(Disruptor<AccountCommandEvent> disruptor) {
		return disruptor.getRingBuffer();
	}
}

package com.example.ledger.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 用來配置可轉換的 Event 類型
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public ObjectMapper eventObjectMapper() {
		return JsonMapper.builder().build();
	}

	/**
	 * Account Event 的 EventCodec 配置
	 */
	@Bean
	public EventJsonCodec<AccountEvent> accountEventJsonCodec(ObjectMapper eventObjectMapper) {
		return new EventJsonCodec<>(eventObjectMapper, AccountEvent.class);
	}
}

package com.example.ledger.config.config;

import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.AuditSinkPort;
import com.example.ledger.application.port.ClockPort;
import com.example.ledger.application.port.IdGeneratorPort;
import com.example.ledger.config.properties.LedgerProperties;
import com.example.ledger.infra.adapter.JsonAuditSinkAdapter;
import com.example.ledger.infra.adapter.LoggingAuditSinkAdapter;
import com.example.ledger.infra.adapter.SystemClockAdapter;
import com.example.ledger.infra.adapter.UuidIdGeneratorAdapter;
import com.example.ledger.infra.event.codec.EventJsonCodec;

/**
 * 聚合根外部能力 (識別碼、時間、稽核輸出) 的注入配置
 *
 * <p>
 * 聚合根不直接呼叫任何全域/靜態的時間或 ID 來源，一律由此處提供的 Port 實作注入，測試時可替換為固定值。
 * </p>
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerInfrastructureConfiguration {

	@Bean
	public IdGeneratorPort idGenerator() {
		return new UuidIdGeneratorAdapter();
	}

	@Bean
	public ClockPort clockPort() {
		return new SystemClockAdapter(Clock.systemUTC());
	}

	/**
	 * 依 {@code ledger.audit.format} 選擇稽核輸出實作
	 */
	@Bean
	public AuditSinkPort auditSink(LedgerProperties properties, EventJsonCodec<AccountEvent> accountEventJsonCodec) {
		return switch (properties.getAudit().getFormat()) {
		case LOG -> new LoggingAuditSinkAdapter();
		case JSON -> new JsonAuditSinkAdapter(accountEventJsonCodec,
				new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
		};
	}
}

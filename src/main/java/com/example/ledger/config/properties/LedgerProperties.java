package com.example.ledger.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 帳本設定 (prefix: ledger)
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

	/**
	 * RingBuffer 容量，必須為 2 的次方
	 */
	private int ringBufferSize = 1024;

	private Audit audit = new Audit();

	private Demo demo = new Demo();

	@Data
	public static class Audit {

		/**
		 * 稽核輸出格式
		 */
		private AuditFormat format = AuditFormat.LOG;
	}

	@Data
	public static class Demo {

		/**
		 * 啟動時是否建立示範帳戶
		 */
		private boolean enabled = false;
	}

	public enum AuditFormat {
		LOG, JSON
	}
}

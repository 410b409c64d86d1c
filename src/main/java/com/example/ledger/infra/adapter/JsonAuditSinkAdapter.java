package com.example.ledger.infra.adapter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

import com.example.ledger.application.domain.account.event.AccountEvent;
import com.example.ledger.application.port.AuditSinkPort;
import com.example.ledger.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 以 JSON Lines 格式匯出稽核軌跡
 *
 * <p>
 * 每筆事件輸出為一行 JSON (固定以 {@code \n} 分隔)，寫入後立即 flush。同一時間只允許一個匯出作業寫入，避免不同帳戶的行互相穿插。
 * </p>
 */
@Slf4j
public class JsonAuditSinkAdapter implements AuditSinkPort {

	private final EventJsonCodec<AccountEvent> codec;
	private final Writer writer;

	public JsonAuditSinkAdapter(EventJsonCodec<AccountEvent> codec, Writer writer) {
		this.codec = codec;
		this.writer = writer;
	}

	@Override
	public synchronized void publish(String accountId, List<AccountEvent> events) {
		try {
			for (AccountEvent event : events) {
				writer.write(codec.toJson(event));
				writer.write('\n');
			}
			writer.flush();
			log.debug(">>> [Audit] 帳戶 {} 已匯出 {} 筆 JSON 事件", accountId, events.size());
		} catch (IOException e) {
			throw new UncheckedIOException("帳戶 " + accountId + " 稽核匯出失敗", e);
		}
	}
}

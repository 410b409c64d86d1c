package com.example.ledger.infra.event.codec;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * 泛型 Domain Event JSON 編解碼器
 *
 * <p>
 * 負責將 Domain Event 與 JSON 之間互相轉換，完全獨立於聚合根與事件日誌。
 * 序列化一律以宣告型別 {@code type} 進行，確保多型事件帶有型別鑑別欄位。
 * 序列化/反序列化失敗均視為系統錯誤。
 * </p>
 */
public class EventJsonCodec<T> {

	private final ObjectMapper objectMapper;
	private final Class<T> type;

	/**
	 * 建構泛型 Codec
	 *
	 * @param objectMapper Jackson ObjectMapper
	 * @param type         Domain Event 類型
	 */
	public EventJsonCodec(ObjectMapper objectMapper, Class<T> type) {
		this.objectMapper = objectMapper;
		this.type = type;
	}

	/**
	 * 將 Domain Event 序列化為 JSON byte[]
	 */
	public byte[] serialize(T event) {
		try {
			return objectMapper.writerFor(type).writeValueAsBytes(event);
		} catch (JacksonException e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 Domain Event 序列化為單行 JSON 字串
	 */
	public String toJson(T event) {
		try {
			return objectMapper.writerFor(type).writeValueAsString(event);
		} catch (JacksonException e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 反序列化回 Domain Event
	 */
	public T deserialize(byte[] data) {
		try {
			return objectMapper.readValue(data, type);
		} catch (JacksonException e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}
}

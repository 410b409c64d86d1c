package com.example.ledger.application.port;

/**
 * 事件識別碼產生 Port
 *
 * <p>
 * 回傳值在整個行程生命週期內必須唯一。
 * </p>
 */
public interface IdGeneratorPort {

	String next();
}

package com.example.ledger.application.port;

import java.time.Instant;

/**
 * 時間來源 Port
 * <p>
 * 僅用於替事件蓋上時間戳記，不參與任何業務判斷。
 * </p>
 */
public interface ClockPort {

	Instant now();
}

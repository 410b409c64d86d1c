package com.example.ledger.infra.adapter;

import java.time.Clock;
import java.time.Instant;

import com.example.ledger.application.port.ClockPort;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SystemClockAdapter implements ClockPort {

	private final Clock clock;

	@Override
	public Instant now() {
		return clock.instant();
	}
}

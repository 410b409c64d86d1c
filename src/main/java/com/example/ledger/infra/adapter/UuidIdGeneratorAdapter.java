package com.example.ledger.infra.adapter;

import java.util.UUID;

import com.example.ledger.application.port.IdGeneratorPort;

/**
 * 以隨機 UUID 作為事件識別碼
 */
public class UuidIdGeneratorAdapter implements IdGeneratorPort {

	@Override
	public String next() {
		return UUID.randomUUID().toString();
	}
}

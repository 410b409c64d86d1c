package com.example.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventSourcedLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(EventSourcedLedgerApplication.class, args);
	}

}

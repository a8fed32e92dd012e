package com.atmledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the ATM Ledger.
 *
 * Hosts a single in-memory teller service that registers accounts by card number
 * and PIN, moves cash in and out of them, and prints per-account transaction ledgers.
 */
@SpringBootApplication
public class AtmLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AtmLedgerApplication.class, args);
    }
}

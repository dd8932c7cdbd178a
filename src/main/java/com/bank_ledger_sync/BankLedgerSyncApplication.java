package com.bank_ledger_sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankLedgerSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankLedgerSyncApplication.class, args);
    }
}

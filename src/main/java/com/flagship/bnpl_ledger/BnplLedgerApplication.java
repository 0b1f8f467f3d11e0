package com.flagship.bnpl_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BnplLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BnplLedgerApplication.class, args);
    }
}

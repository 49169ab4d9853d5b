package com.flagship.retail_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetailLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RetailLedgerApplication.class, args);
    }
}

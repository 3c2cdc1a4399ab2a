package com.holdingsledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HoldingsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoldingsLedgerApplication.class, args);
    }
}

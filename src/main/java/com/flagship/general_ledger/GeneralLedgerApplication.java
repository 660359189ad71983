package com.flagship.general_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GeneralLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeneralLedgerApplication.class, args);
    }
}

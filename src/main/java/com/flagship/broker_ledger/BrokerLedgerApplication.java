package com.flagship.broker_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BrokerLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrokerLedgerApplication.class, args);
    }
}

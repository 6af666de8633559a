package com.flagship.live_event_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiveEventLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveEventLedgerApplication.class, args);
    }
}

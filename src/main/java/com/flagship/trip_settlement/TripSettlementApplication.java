package com.flagship.trip_settlement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TripSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripSettlementApplication.class, args);
    }
}

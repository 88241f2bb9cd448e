package com.dinepos.orderservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.dinepos.orderservice", "com.dinepos.common"})
@EnableScheduling
public class PosOrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosOrderServiceApplication.class, args);
    }
}

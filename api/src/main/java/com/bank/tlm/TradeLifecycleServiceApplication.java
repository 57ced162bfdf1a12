package com.bank.tlm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication(scanBasePackages = "com.bank.tlm")
@EnableTransactionManagement
public class TradeLifecycleServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeLifecycleServiceApplication.class, args);
    }
}

package com.petwash.ledger;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
@MapperScan(basePackages = "com.petwash.ledger.audit")
@Slf4j
public class LedgerApplication {

    public static void main(String[] args) {
        log.info("Starting audit ledger application");
        SpringApplication.run(LedgerApplication.class, args);
        log.info("Audit ledger application started");
    }

}

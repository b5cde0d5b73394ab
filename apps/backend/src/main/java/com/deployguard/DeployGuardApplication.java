package com.deployguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class DeployGuardApplication {

    public static void main(String[] args) {
        log.info("Starting DeployGuard");
        SpringApplication.run(DeployGuardApplication.class, args);
        log.info("DeployGuard started");
    }
}

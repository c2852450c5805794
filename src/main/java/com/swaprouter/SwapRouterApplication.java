package com.swaprouter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SwapRouterApplication {

    private static final Logger log = LoggerFactory.getLogger(SwapRouterApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SwapRouterApplication.class, args);
        log.info("Swap Router started.");
        log.info("Routes:  GET http://localhost:8080/routes?chain=wax&input=<token>&output=<token>&tradeType=EXACT_INPUT&maxHops=2");
        log.info("Status:  GET http://localhost:8080/status");
        log.info("Health:  GET http://localhost:8080/actuator/health");
    }
}

package com.amblue.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AmBlueAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(AmBlueAgentApplication.class, args);
    }
}

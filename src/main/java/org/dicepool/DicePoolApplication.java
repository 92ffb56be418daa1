package org.dicepool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling  // heartbeat SSE du wallet
public class DicePoolApplication {
    public static void main(String[] args) {
        SpringApplication.run(DicePoolApplication.class, args);
    }
}

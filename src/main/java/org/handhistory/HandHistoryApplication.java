package org.handhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HandHistoryApplication {
    public static void main(String[] args) {
        SpringApplication.run(HandHistoryApplication.class, args);
    }
}

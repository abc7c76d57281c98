package com.nosota.landmarket;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LandMarketApplication {

    public static void main(String[] args) {
        SpringApplication.run(LandMarketApplication.class, args);
    }
}

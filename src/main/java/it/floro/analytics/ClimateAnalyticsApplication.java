package it.floro.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClimateAnalyticsApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClimateAnalyticsApplication.class, args);
    }
}

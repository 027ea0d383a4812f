package com.racelisting.racing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Racing Service
 *
 * Read-only listing of races backed by SQLite. Clients filter by meeting,
 * visibility or id and may order by any column of the races table.
 */
@SpringBootApplication(scanBasePackages = "com.racelisting")
public class RacingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RacingServiceApplication.class, args);
    }

}

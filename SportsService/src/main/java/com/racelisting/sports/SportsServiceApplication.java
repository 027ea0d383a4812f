package com.racelisting.sports;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sports Service
 *
 * Read-only listing of sporting events backed by SQLite. Each listed event is
 * named "away vs home" and carries an OPEN/CLOSED status computed at read time.
 */
@SpringBootApplication(scanBasePackages = "com.racelisting")
public class SportsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SportsServiceApplication.class, args);
    }

}

package com.fieldreport.impound;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Impound release service: inspection intake, partial releases against the impounded
 * quantity and owner SMS notifications.
 */
@SpringBootApplication
public class ImpoundReleaseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImpoundReleaseApplication.class, args);
    }
}

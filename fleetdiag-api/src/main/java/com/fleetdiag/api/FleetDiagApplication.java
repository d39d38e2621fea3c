package com.fleetdiag.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the fleet diagnostics service.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.fleetdiag.api",
    "com.fleetdiag.engine.metrics"
})
public class FleetDiagApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetDiagApplication.class, args);
    }
}

package com.termbridge.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * termbridge application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.termbridge")
public class TermBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TermBridgeApplication.class, args);
    }
}

package com.dorkscan.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DorkScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DorkScannerApplication.class, args);
    }
}

package com.herzen.dropout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DropoutDetectorApplication {
    public static void main(String[] args) {
        SpringApplication.run(DropoutDetectorApplication.class, args);
    }
}

package com.flagship.missed_call;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MissedCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(MissedCallApplication.class, args);
    }
}

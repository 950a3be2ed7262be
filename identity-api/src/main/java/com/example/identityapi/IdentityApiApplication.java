package com.example.identityapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IdentityApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdentityApiApplication.class, args);
    }
}

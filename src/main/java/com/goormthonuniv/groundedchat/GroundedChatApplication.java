package com.goormthonuniv.groundedchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GroundedChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroundedChatApplication.class, args);
    }
}

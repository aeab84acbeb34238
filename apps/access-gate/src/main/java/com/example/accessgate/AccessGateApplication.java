package com.example.accessgate;

import com.example.accessgate.config.properties.AccessGateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AccessGateProperties.class)
public class AccessGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessGateApplication.class, args);
    }

}

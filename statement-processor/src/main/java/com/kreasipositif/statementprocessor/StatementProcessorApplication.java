package com.kreasipositif.statementprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class StatementProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatementProcessorApplication.class, args);
    }
}

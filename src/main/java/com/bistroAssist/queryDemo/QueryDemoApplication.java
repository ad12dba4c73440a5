package com.bistroAssist.queryDemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryDemoApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryDemoApplication.class, args);
    }
}

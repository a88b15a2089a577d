package com.example.CostNavigator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CostNavigatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostNavigatorApplication.class, args);
    }
}

package com.gocomet.zonerevenue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ZoneRevenueApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZoneRevenueApplication.class, args);
    }
}

package com.districtintel.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class DistrictEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(DistrictEngineApplication.class, args);
    }
}

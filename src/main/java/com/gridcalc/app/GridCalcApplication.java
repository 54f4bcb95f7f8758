package com.gridcalc.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GridCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridCalcApplication.class, args);
    }
}

package com.legisgraph.citegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CitationGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitationGraphApplication.class, args);
    }
}

package com.citeval.runs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CitationRunsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitationRunsApplication.class, args);
    }
}

package com.codevision.playground;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CodeVisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeVisionApplication.class, args);
    }
}

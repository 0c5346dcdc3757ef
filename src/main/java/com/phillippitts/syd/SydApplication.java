package com.phillippitts.syd;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class SydApplication {

    public static void main(String[] args) {
        SpringApplication.run(SydApplication.class, args);
    }

}

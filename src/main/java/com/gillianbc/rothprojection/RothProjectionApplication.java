package com.gillianbc.rothprojection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RothProjectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RothProjectionApplication.class, args);
    }
}

package com.bmsedge.cbcr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CbcrConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(CbcrConverterApplication.class, args);
    }
}

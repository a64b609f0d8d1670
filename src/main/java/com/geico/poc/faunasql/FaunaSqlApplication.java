package com.geico.poc.faunasql;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FaunaSqlApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaunaSqlApplication.class, args);
    }
}

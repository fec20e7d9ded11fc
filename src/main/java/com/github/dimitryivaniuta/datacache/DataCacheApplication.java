package com.github.dimitryivaniuta.datacache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataCacheApplication.class, args);
    }
}

package com.echopaw.regions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegionCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegionCacheApplication.class, args);
    }
}

package com.sheetdash.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetDashApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetDashApplication.class, args);
    }
}

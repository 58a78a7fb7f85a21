package com.catalogiq.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.catalogiq")
public class CatalogiqApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatalogiqApplication.class, args);
    }
}

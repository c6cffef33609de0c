package com.vendorhub.marketplace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VendorHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(VendorHubApplication.class, args);
    }
}

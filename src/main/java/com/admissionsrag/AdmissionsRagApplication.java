package com.admissionsrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class AdmissionsRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdmissionsRagApplication.class, args);
    }
}

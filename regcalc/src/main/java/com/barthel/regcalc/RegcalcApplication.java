package com.barthel.regcalc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegcalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegcalcApplication.class, args);
    }
}

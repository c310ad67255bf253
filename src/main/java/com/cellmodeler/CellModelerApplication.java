package com.cellmodeler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CellModelerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CellModelerApplication.class, args);
    }
}

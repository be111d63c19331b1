package com.gedcomtree;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GedcomTreeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GedcomTreeApplication.class, args);
    }
}

package com.example.formstructure;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormStructureApplication {

    public static void main(String[] args) {
        SpringApplication.run(FormStructureApplication.class, args);
    }

}

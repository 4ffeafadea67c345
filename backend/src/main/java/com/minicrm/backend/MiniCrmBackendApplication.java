package com.minicrm.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MiniCrmBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiniCrmBackendApplication.class, args);
    }
}

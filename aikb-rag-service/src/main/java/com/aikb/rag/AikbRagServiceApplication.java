package com.aikb.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AikbRagServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AikbRagServiceApplication.class, args);
    }
}

package com.architecture.dotspace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DotspaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DotspaceApplication.class, args);
    }
}

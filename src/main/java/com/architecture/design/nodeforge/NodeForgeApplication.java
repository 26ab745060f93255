package com.architecture.design.nodeforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NodeForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(NodeForgeApplication.class, args);
    }
}

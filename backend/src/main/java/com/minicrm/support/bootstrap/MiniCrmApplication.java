package com.minicrm.support.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.minicrm.support")
public class MiniCrmApplication {
    public static void main(String[] args) {
        SpringApplication.run(MiniCrmApplication.class, args);
    }
}

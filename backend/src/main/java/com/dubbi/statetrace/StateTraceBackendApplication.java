package com.dubbi.statetrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StateTraceBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(StateTraceBackendApplication.class, args);
    }
}

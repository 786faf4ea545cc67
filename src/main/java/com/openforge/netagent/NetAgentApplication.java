package com.openforge.netagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetAgentApplication.class, args);
    }
}

package com.purchasingpower.designflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DesignFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(DesignFlowApplication.class, args);
    }
}

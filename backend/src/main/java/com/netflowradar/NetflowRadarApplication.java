package com.netflowradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NetflowRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetflowRadarApplication.class, args);
    }
}

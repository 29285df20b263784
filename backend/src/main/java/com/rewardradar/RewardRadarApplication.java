package com.rewardradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RewardRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RewardRadarApplication.class, args);
    }
}

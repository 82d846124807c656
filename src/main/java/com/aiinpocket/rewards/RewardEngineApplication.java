package com.aiinpocket.rewards;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RewardEngineProperties.class)
public class RewardEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RewardEngineApplication.class, args);
    }

}

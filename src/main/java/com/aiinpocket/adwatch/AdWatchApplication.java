package com.aiinpocket.adwatch;

import com.aiinpocket.adwatch.config.AdWatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AdWatchProperties.class)
public class AdWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdWatchApplication.class, args);
    }

}

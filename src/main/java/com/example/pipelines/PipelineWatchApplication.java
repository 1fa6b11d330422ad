package com.example.pipelines;

import com.example.pipelines.backend.GatewayProperties;
import com.example.pipelines.core.CacheProperties;
import com.example.pipelines.updates.UpdateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({CacheProperties.class, UpdateProperties.class, GatewayProperties.class})
public class PipelineWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineWatchApplication.class, args);
    }
}

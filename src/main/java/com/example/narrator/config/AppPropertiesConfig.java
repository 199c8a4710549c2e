package com.example.narrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        PipelineProperties.class,
        VideoProperties.class,
        IntakeProperties.class,
        AiServicesProperties.class
})
public class AppPropertiesConfig {
}

package com.sapa.speakers;

import com.sapa.speakers.config.AppProperties;
import com.sapa.speakers.config.NotionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({NotionProperties.class, AppProperties.class})
public class SpeakerTrackerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SpeakerTrackerApplication.class, args);
    }
}

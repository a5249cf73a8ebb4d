package com.voxnote.api;

import com.voxnote.api.config.ConversationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ConversationProperties.class)
public class VoxnoteApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoxnoteApiApplication.class, args);
    }
}

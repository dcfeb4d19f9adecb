package com.photoraces;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.photoraces.config.AppProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class PhotoRacesApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoRacesApplication.class, args);
    }
}

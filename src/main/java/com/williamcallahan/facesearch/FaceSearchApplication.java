package com.williamcallahan.facesearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FaceSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceSearchApplication.class, args);
    }

}

package com.studytrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StudyTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudyTrackApplication.class, args);
    }
}

package com.studytrack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "studytrack")
public record StudyTrackProperties(@DefaultValue("data/studytrack.json") Path storePath,
                                   @DefaultValue("SAMPLE") BootstrapMode bootstrap,
                                   @DefaultValue("5") double importModuleCredits,
                                   @DefaultValue("30") int upcomingDays) {

    public enum BootstrapMode { SAMPLE, NONE }
}

package com.musicinsights.playlistorganizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlaylistOrganizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaylistOrganizerApplication.class, args);
    }
}

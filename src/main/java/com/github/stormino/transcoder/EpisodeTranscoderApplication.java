package com.github.stormino.transcoder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EpisodeTranscoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(EpisodeTranscoderApplication.class, args);
    }
}

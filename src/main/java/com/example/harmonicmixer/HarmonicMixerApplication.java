package com.example.harmonicmixer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HarmonicMixerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HarmonicMixerApplication.class, args);
    }
}

package com.signalpro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.signalpro.render.config", "com.signalpro.output.config"})
public class SignalProApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalProApplication.class, args);
    }
}

package com.shepherd;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class ShepherdApplication {

    public static void main(String[] args) {
        log.info("Starting shepherd");
        SpringApplication.run(ShepherdApplication.class, args);
        log.info("shepherd finished");
    }

}

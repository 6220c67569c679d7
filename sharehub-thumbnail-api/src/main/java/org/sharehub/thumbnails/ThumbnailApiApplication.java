package org.sharehub.thumbnails;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ThumbnailApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(ThumbnailApiApplication.class, args);
    }

}

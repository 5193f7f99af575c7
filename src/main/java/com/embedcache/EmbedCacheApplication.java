package com.embedcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for embed-cache - a transparent cache in front of text embedding models.
 */
@SpringBootApplication
public class EmbedCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmbedCacheApplication.class, args);
    }
}

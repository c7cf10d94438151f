package com.filedrop.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * FileDrop receiving server.
 * Settings come from {@code filedrop.server.*}, e.g. {@code --filedrop.server.port=9000}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class FileDropServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FileDropServerApplication.class, args);
    }
}

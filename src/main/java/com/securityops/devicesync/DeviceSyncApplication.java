package com.securityops.devicesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling // Drives the cross-sync cron trigger
public class DeviceSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(DeviceSyncApplication.class, args);
    }
}

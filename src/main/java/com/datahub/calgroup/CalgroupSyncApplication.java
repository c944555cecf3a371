package com.datahub.calgroup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // Necessary to enable the @Scheduled sync job
public class CalgroupSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(CalgroupSyncApplication.class, args);
    }
}

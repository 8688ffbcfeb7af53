package com.example.careaccess;

import com.example.careaccess.config.properties.AuditProperties;
import com.example.careaccess.config.properties.EmergencyAccessProperties;
import com.example.careaccess.config.properties.RelationshipProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
        EmergencyAccessProperties.class,
        AuditProperties.class,
        RelationshipProperties.class
})
public class CareAccessApplication {

    public static void main(String[] args) {
        SpringApplication.run(CareAccessApplication.class, args);
    }

}

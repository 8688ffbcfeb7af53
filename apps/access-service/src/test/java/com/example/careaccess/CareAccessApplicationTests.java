package com.example.careaccess;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CareAccessApplicationTests {

    @Test
    void contextLoads() {
        // Basic context load test
    }
}

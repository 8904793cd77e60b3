package com.trippy.server;

import com.trippy.common.properties.RecommendProperties;
import com.trippy.common.properties.VectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({RecommendProperties.class, VectorProperties.class})
public class TrippyServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrippyServerApplication.class, args);
    }
}

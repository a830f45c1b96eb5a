package com.wayfarer.server;

import com.wayfarer.common.properties.AiProperties;
import com.wayfarer.common.properties.JwtProperties;
import com.wayfarer.common.properties.MediaProperties;
import com.wayfarer.common.properties.PlannerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({JwtProperties.class, AiProperties.class, PlannerProperties.class, MediaProperties.class})
public class WayfarerServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WayfarerServerApplication.class, args);
    }
}

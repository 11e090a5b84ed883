package com.phillippitts.funnel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.funnel.config.properties.RelayProperties.class,
        com.phillippitts.funnel.config.properties.BackendProperties.class,
        com.phillippitts.funnel.config.properties.ClientProperties.class,
        com.phillippitts.funnel.config.properties.AudioCaptureProperties.class
})
@EnableScheduling
public class FunnelApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunnelApplication.class, args);
    }

}

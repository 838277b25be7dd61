package com.phillippitts.callcopilot;

import com.phillippitts.callcopilot.config.properties.FrontendProperties;
import com.phillippitts.callcopilot.config.properties.ProviderProperties;
import com.phillippitts.callcopilot.config.properties.ResilienceProperties;
import com.phillippitts.callcopilot.config.properties.SessionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ResilienceProperties.class,
        ProviderProperties.class,
        FrontendProperties.class,
        SessionProperties.class
})
@EnableScheduling
public class CallCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallCopilotApplication.class, args);
    }

}

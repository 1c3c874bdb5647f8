package com.phillippitts.voiceorders;

import com.phillippitts.voiceorders.config.properties.BackendProperties;
import com.phillippitts.voiceorders.config.properties.OrderDataProperties;
import com.phillippitts.voiceorders.config.properties.SessionProperties;
import com.phillippitts.voiceorders.config.properties.VadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        BackendProperties.class,
        SessionProperties.class,
        VadProperties.class,
        OrderDataProperties.class
})
@EnableScheduling
public class VoiceOrdersApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceOrdersApplication.class, args);
    }

}

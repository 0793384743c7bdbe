package com.phillippitts.navguide;

import com.phillippitts.navguide.config.properties.DecisionProperties;
import com.phillippitts.navguide.config.properties.DepthProperties;
import com.phillippitts.navguide.config.properties.GateProperties;
import com.phillippitts.navguide.config.properties.LegacyProperties;
import com.phillippitts.navguide.config.properties.SpeechProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        DecisionProperties.class,
        GateProperties.class,
        LegacyProperties.class,
        DepthProperties.class,
        SpeechProperties.class
})
@EnableScheduling
public class NavGuideApplication {

    public static void main(String[] args) {
        SpringApplication.run(NavGuideApplication.class, args);
    }

}

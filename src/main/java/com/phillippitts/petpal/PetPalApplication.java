package com.phillippitts.petpal;

import com.phillippitts.petpal.config.properties.ActionProperties;
import com.phillippitts.petpal.config.properties.BroadcastProperties;
import com.phillippitts.petpal.config.properties.CapabilityProperties;
import com.phillippitts.petpal.config.properties.CommandProperties;
import com.phillippitts.petpal.config.properties.EventPipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        CommandProperties.class,
        BroadcastProperties.class,
        EventPipelineProperties.class,
        ActionProperties.class,
        CapabilityProperties.class
})
@EnableScheduling
public class PetPalApplication {

    public static void main(String[] args) {
        SpringApplication.run(PetPalApplication.class, args);
    }

}

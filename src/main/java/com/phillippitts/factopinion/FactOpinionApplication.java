package com.phillippitts.factopinion;

import com.phillippitts.factopinion.config.properties.AnnotatorProperties;
import com.phillippitts.factopinion.config.properties.DispatchProperties;
import com.phillippitts.factopinion.config.properties.EnsembleProperties;
import com.phillippitts.factopinion.config.properties.FusionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        FusionProperties.class,
        EnsembleProperties.class,
        AnnotatorProperties.class,
        DispatchProperties.class
})
@EnableScheduling
public class FactOpinionApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactOpinionApplication.class, args);
    }

}

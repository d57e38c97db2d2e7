package com.phillippitts.windowanalysis;

import com.phillippitts.windowanalysis.config.properties.NormalizerProperties;
import com.phillippitts.windowanalysis.config.properties.OfflineProperties;
import com.phillippitts.windowanalysis.config.properties.OrchestrationProperties;
import com.phillippitts.windowanalysis.config.properties.ProviderProperties;
import com.phillippitts.windowanalysis.config.properties.RateLimitProperties;
import com.phillippitts.windowanalysis.config.properties.RetryProperties;
import com.phillippitts.windowanalysis.config.properties.StoreProperties;
import com.phillippitts.windowanalysis.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        OrchestrationProperties.class,
        RetryProperties.class,
        RateLimitProperties.class,
        ProviderProperties.class,
        NormalizerProperties.class,
        StoreProperties.class,
        OfflineProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class WindowAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(WindowAnalysisApplication.class, args);
    }

}

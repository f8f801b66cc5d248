package com.matey.anomaly.bridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.config.FeedConfig;
import com.matey.anomaly.core.config.JacksonConfig;
import com.matey.anomaly.core.io.NdjsonWriter;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({JacksonConfig.class, FeedConfig.class, ApplicationTerminator.class})
public class BridgeConfig {

    /**
     * Record output on the process's stdout. Logging is routed to stderr by
     * logback-spring.xml so this stream carries data only.
     */
    @Bean
    public NdjsonWriter recordWriter(ObjectMapper objectMapper) {
        return new NdjsonWriter(objectMapper, System.out);
    }
}

package com.platform.drcontrol.config;

import com.platform.drcontrol.connectors.dynamodb.RegionalClientFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * AWS client wiring. Clients are created per region on demand and closed with the context.
 */
@Configuration
public class AwsClientConfig {
    
    @Bean(destroyMethod = "close")
    public RegionalClientFactory regionalClientFactory(DrControlProperties properties) {
        return new RegionalClientFactory(properties.getAws());
    }
}

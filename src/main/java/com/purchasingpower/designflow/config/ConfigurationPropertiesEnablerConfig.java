package com.purchasingpower.designflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes that are not components themselves.
 */
@Configuration
@EnableConfigurationProperties({
    HeuristicsConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}

package com.holdingsledger.costbasis.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Cost-basis module configuration: binds {@link CostBasisProperties}.
 */
@Configuration
@EnableConfigurationProperties(CostBasisProperties.class)
public class CostBasisConfig {
}

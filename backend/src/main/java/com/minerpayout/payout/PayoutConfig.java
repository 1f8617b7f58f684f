package com.minerpayout.payout;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers payout settings (minerpayout.payout.*).
 */
@Configuration
@EnableConfigurationProperties(PayoutProperties.class)
public class PayoutConfig {
}

package com.opsagent.tracker.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${tracker.ratelimit.write-qps:0}")
    private double writeRateLimit;

    @Bean("writeRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter writeRateLimiter() {
        return createOptionalLimiter(writeRateLimit);
    }

    static RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}

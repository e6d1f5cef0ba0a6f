package com.example.icc.config;

import com.example.icc.service.ApplauseSettings;
import org.springframework.core.env.Environment;

import java.time.Duration;

/**
 * Applause settings taken from the environment. Looked up on every call, so a refreshed
 * property is picked up by the next tick.
 */
public class PropertyApplauseSettings implements ApplauseSettings {

    static final String INTERVAL_PROPERTY = "icc.applause.interval";
    static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(5);

    private final Environment environment;

    public PropertyApplauseSettings(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Duration applauseInterval() {
        Duration interval = environment.getProperty(INTERVAL_PROPERTY, Duration.class, DEFAULT_INTERVAL);
        return interval.isNegative() || interval.isZero() ? DEFAULT_INTERVAL : interval;
    }
}

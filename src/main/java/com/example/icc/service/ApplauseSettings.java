package com.example.icc.service;

import java.time.Duration;

/**
 * Meeting settings the applause service depends on.
 */
public interface ApplauseSettings {

    /**
     * How far back an applause still counts. Read on every tick, so implementations may
     * return a different value once the setting changes.
     */
    Duration applauseInterval();
}

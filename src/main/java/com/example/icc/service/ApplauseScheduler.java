package com.example.icc.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Background loops of the applause service. They run until the application context shuts
 * down; a failed tick is logged and retried on the next one.
 */
@Service
public class ApplauseScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ApplauseScheduler.class);

    private final ApplauseService applauseService;

    public ApplauseScheduler(ApplauseService applauseService) {
        this.applauseService = applauseService;
    }

    @Scheduled(fixedDelayString = "${icc.applause.publish-delay-ms:1000}", initialDelay = 1000L)
    public void publishLevel() {
        try {
            applauseService.publishLevel();
        } catch (RuntimeException e) {
            logger.warn("Publishing applause level failed: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${icc.applause.prune-delay-ms:60000}", initialDelay = 5000L)
    public void pruneOldData() {
        try {
            long boundary = applauseService.pruneOldData();
            logger.debug("Pruned applause older than {}", boundary);
        } catch (RuntimeException e) {
            logger.warn("Pruning old applause failed: {}", e.getMessage());
        }
    }
}

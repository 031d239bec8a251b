package com.williamcallahan.facesearch.service;

import java.time.Duration;

/**
 * Waits between regeneration batches.
 */
@FunctionalInterface
public interface BatchPause {

    void pause(Duration delay) throws InterruptedException;
}

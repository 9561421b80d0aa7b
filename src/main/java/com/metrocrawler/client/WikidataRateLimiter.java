package com.metrocrawler.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Spaces Wikidata API requests at least {@code wikidata.api.min-interval-ms}
 * apart, across all crawl threads.
 */
@Component
public class WikidataRateLimiter {

    @Value("${wikidata.api.min-interval-ms:100}")
    private long minRequestIntervalMs;

    private long nextSlot;

    /**
     * Blocks until the caller's request slot. Slots are handed out in call
     * order; callers sleep outside the lock, each until its own slot.
     *
     * @throws IllegalStateException when the calling thread is interrupted; the
     *                               request must then not be sent
     */
    public void acquire() {
        if (Thread.currentThread().isInterrupted()) {
            throw new IllegalStateException("Crawl thread interrupted, Wikidata request not sent");
        }
        long waitMs = reserveSlot();
        if (waitMs <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a Wikidata request slot", e);
        }
    }

    private synchronized long reserveSlot() {
        long now = System.currentTimeMillis();
        long slot = Math.max(now, nextSlot);
        nextSlot = slot + minRequestIntervalMs;
        return slot - now;
    }
}

package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Spaces out page fetches: the configured delay, randomly stretched or shrunk by up to the
 * jitter ratio.
 */
@Component
public class FetchPacer {
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final HuntProperties properties;
    private final Sleeper sleeper;
    private final Random random;

    @Autowired
    public FetchPacer(HuntProperties properties) {
        this(properties, Thread::sleep, new Random());
    }

    FetchPacer(HuntProperties properties, Sleeper sleeper, Random random) {
        this.properties = properties;
        this.sleeper = sleeper;
        this.random = random;
    }

    long nextDelayMillis() {
        double baseMillis = properties.getFetch().getDelaySeconds() * 1000.0;
        double jitter = baseMillis * properties.getFetch().getJitterRatio();
        double delay = baseMillis + (random.nextDouble() * 2.0 - 1.0) * jitter;
        return Math.max(0L, Math.round(delay));
    }

    /**
     * Waits before the next fetch. Returns false, with the interrupt flag restored, when the
     * wait was interrupted.
     */
    public boolean pause() {
        long millis = nextDelayMillis();
        if (millis == 0) {
            return true;
        }
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

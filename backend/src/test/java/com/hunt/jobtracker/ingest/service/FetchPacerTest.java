package com.hunt.jobtracker.ingest.service;

import com.hunt.jobtracker.config.HuntProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FetchPacerTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void delayStaysWithinJitterBounds() {
        FetchPacer pacer = new FetchPacer(properties(5.0, 0.2), millis -> { }, new Random(42));

        for (int i = 0; i < 200; i++) {
            assertThat(pacer.nextDelayMillis()).isBetween(4000L, 6000L);
        }
    }

    @Test
    void lowestDrawGivesShortestDelay() {
        Random lowest = new Random() {
            @Override
            public double nextDouble() {
                return 0.0;
            }
        };
        FetchPacer pacer = new FetchPacer(properties(5.0, 0.2), millis -> { }, lowest);

        assertEquals(4000L, pacer.nextDelayMillis());
    }

    @Test
    void pauseSleepsForTheDelay() {
        List<Long> slept = new ArrayList<>();
        FetchPacer pacer = new FetchPacer(properties(2.0, 0.0), slept::add, new Random());

        assertTrue(pacer.pause());
        assertThat(slept).containsExactly(2000L);
    }

    @Test
    void interruptedPauseRestoresFlag() {
        FetchPacer pacer = new FetchPacer(properties(1.0, 0.0), millis -> {
            throw new InterruptedException();
        }, new Random());

        assertFalse(pacer.pause());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    private static HuntProperties properties(double delaySeconds, double jitterRatio) {
        HuntProperties properties = new HuntProperties();
        properties.getFetch().setDelaySeconds(delaySeconds);
        properties.getFetch().setJitterRatio(jitterRatio);
        return properties;
    }
}

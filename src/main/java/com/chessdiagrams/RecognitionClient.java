package com.chessdiagrams;

import java.util.Random;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential, rate-limited access to a {@link RecognitionService}. Waits a random
 * delay before every call and turns every failure into a null result.
 */
public class RecognitionClient {

    private static final Logger log = LoggerFactory.getLogger(RecognitionClient.class);

    /** Blocking wait between calls. */
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RecognitionService service;
    private final long minDelayMillis;
    private final long maxDelayMillis;
    private final Random random;
    private final Sleeper sleeper;

    private int calls;
    private int failures;

    public RecognitionClient(RecognitionService service, double minDelaySeconds, double maxDelaySeconds) {
        this(service, minDelaySeconds, maxDelaySeconds, new Random(), Thread::sleep);
    }

    RecognitionClient(RecognitionService service, double minDelaySeconds, double maxDelaySeconds,
                      Random random, Sleeper sleeper) {
        if (minDelaySeconds < 0 || minDelaySeconds > maxDelaySeconds) {
            throw new ConfigurationException("Invalid delay range " + minDelaySeconds + ".." + maxDelaySeconds);
        }
        this.service = service;
        this.minDelayMillis = Math.round(minDelaySeconds * 1000);
        this.maxDelayMillis = Math.round(maxDelaySeconds * 1000);
        this.random = random;
        this.sleeper = sleeper;
    }

    /**
     * @return the recognized position, or null when the call failed
     */
    public synchronized RecognitionResult recognize(Mat boardImage) {
        calls++;
        try {
            long delay = nextDelay();
            log.debug("Waiting {} ms before recognition call", delay);
            sleeper.sleep(delay);

            RecognitionResult result = service.recognize(boardImage);
            log.info("Recognized {}", result);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failures++;
            log.warn("Recognition call interrupted");
            return null;
        } catch (Exception e) {
            failures++;
            log.warn("Recognition call failed: {}", e.toString());
            return null;
        }
    }

    long nextDelay() {
        if (maxDelayMillis == minDelayMillis) {
            return minDelayMillis;
        }
        return minDelayMillis + (long) (random.nextDouble() * (maxDelayMillis - minDelayMillis));
    }

    public synchronized int getCalls() {
        return calls;
    }

    public synchronized int getFailures() {
        return failures;
    }
}

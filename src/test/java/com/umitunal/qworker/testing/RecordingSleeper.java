package com.umitunal.qworker.testing;

import com.umitunal.qworker.worker.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records requested sleeps and aborts the calling loop on the first one.
 */
public class RecordingSleeper implements Sleeper {
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        throw new AbortLoop();
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }
}

package io.github.drompincen.taskclaw.runtime.retry;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

package io.helmttl.services;

import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Repeats a check at a fixed interval until it yields a value or a deadline is reached.
 * <p>
 * The clock and the sleep are injected so waits can be simulated without wall-clock delays. Cancellation is
 * thread interruption: an interrupted sleep ends the wait with an {@link InterruptedException}.
 */
@Getter
public class Poller {
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;

    public Poller(Duration interval, Clock clock, Sleeper sleeper) {
        this.interval = interval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static Poller every(Duration interval) {
        return new Poller(interval, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public Instant deadline(Duration timeout) {
        return clock.instant().plus(timeout);
    }

    /**
     * Runs {@code check} until it returns a value. An exception thrown by the check ends the wait immediately.
     *
     * @return the value, or empty if {@code deadline} was reached first
     */
    public <T> Optional<T> until(Instant deadline, Supplier<Optional<T>> check) throws InterruptedException {
        while (true) {
            Optional<T> value = check.get();
            if (value.isPresent()) {
                return value;
            }

            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                return Optional.empty();
            }

            Duration remaining = Duration.between(now, deadline);
            sleeper.sleep(remaining.compareTo(interval) < 0 ? remaining : interval);
        }
    }
}

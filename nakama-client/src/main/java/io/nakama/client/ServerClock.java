package io.nakama.client;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic estimate of the server's clock, fed by heartbeats.
 *
 * <p>A heartbeat older than or equal to the latest one observed is ignored, so the value never
 * goes backwards. Until the first heartbeat arrives the local wall clock stands in.
 */
public final class ServerClock {

    private static final long UNSET = 0L;

    private final Clock wallClock;
    private final AtomicLong serverTime = new AtomicLong(UNSET);

    public ServerClock(Clock wallClock) {
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Records a heartbeat timestamp.
     *
     * @param candidate server time in epoch milliseconds
     * @return {@code true} if the estimate moved forward
     */
    public boolean observe(long candidate) {
        long current;
        do {
            current = serverTime.get();
            if (candidate <= current) {
                return false;
            }
        } while (!serverTime.compareAndSet(current, candidate));
        return true;
    }

    /**
     * @return the latest heartbeat time, or the wall clock if none has been observed
     */
    public long read() {
        long current = serverTime.get();
        return current > UNSET ? current : wallClock.millis();
    }

    public boolean isSynchronized() {
        return serverTime.get() > UNSET;
    }
}

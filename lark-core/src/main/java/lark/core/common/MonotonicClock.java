package lark.core.common;

/**
 * Source of monotonic time readings in nanoseconds.
 * <p>
 * Readings are only meaningful relative to each other and must be compared
 * by subtraction, never directly, so that numeric overflow of the underlying
 * counter does not invert the ordering.
 */
@FunctionalInterface
public interface MonotonicClock {

    long nanos();

    static MonotonicClock system() {
        return System::nanoTime;
    }

    /**
     * Returns true when {@code deadline} is at or before {@code now}.
     */
    static boolean hasPassed(long deadline, long now) {
        return now - deadline >= 0;
    }
}

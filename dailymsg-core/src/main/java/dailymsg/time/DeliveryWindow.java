package dailymsg.time;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open UTC interval {@code [start, end)} in which a delivery may start.
 */
public record DeliveryWindow(Instant start, Instant end) {

    public DeliveryWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("start must be before end: " + start + " / " + end);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}

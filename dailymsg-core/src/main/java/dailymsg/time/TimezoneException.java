package dailymsg.time;

/**
 * Base class for failures resolving a subscriber's delivery window.
 *
 * <p>Callers that schedule many subscribers treat this as a per-subscriber skip.
 */
public class TimezoneException extends RuntimeException {

    public TimezoneException(String message) {
        super(message);
    }

    public TimezoneException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dailymsg.schedule;

/**
 * Thrown when {@link Scheduler#scheduleDay} is called with invalid input, or when the
 * store cannot be reached at all. Nothing is scheduled by the failing call.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}

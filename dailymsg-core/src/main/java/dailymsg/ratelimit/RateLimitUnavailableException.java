package dailymsg.ratelimit;

/**
 * Thrown when shared bucket state cannot be read or written.
 */
public class RateLimitUnavailableException extends RuntimeException {

    public RateLimitUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package dailymsg.time;

/**
 * Thrown when a delivery window's hours are out of range, inverted, or map to an
 * empty UTC interval.
 */
public class InvalidWindowException extends TimezoneException {

    public InvalidWindowException(String message) {
        super(message);
    }
}

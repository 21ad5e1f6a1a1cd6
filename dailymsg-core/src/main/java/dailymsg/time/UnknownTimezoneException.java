package dailymsg.time;

/**
 * Thrown when a timezone name is not a recognized zone id.
 */
public class UnknownTimezoneException extends TimezoneException {
    private final String timezone;

    public UnknownTimezoneException(String timezone, Throwable cause) {
        super("Unknown timezone: " + timezone, cause);
        this.timezone = timezone;
    }

    public String timezone() {
        return timezone;
    }
}

package dailymsg.time;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Converts a local delivery window on a calendar date into UTC instants.
 *
 * <p>Each endpoint is converted on its own using the zone's rules for that wall-clock
 * time, so a window on a daylight-saving transition date gets the offset that is
 * actually in force at each end. A wall time inside a spring-forward gap is moved
 * forward by the length of the gap; an ambiguous time in a fall-back overlap uses
 * the earlier offset. Hour {@code 24} denotes local midnight of the following day.
 *
 * <p>Stateless and thread-safe.
 */
public final class TimezoneResolver {

    /**
     * Resolves the window {@code [localHourStart, localHourEnd)} on {@code onDate}.
     *
     * @param timezoneName   IANA zone id, for example {@code America/New_York}
     * @param localHourStart first local hour of the window, {@code 0..23}
     * @param localHourEnd   local hour the window closes, {@code 1..24}
     * @param onDate         local calendar date
     * @return the UTC window
     * @throws UnknownTimezoneException if the zone id is not recognized
     * @throws InvalidWindowException   if the hours are out of range or {@code start >= end}
     */
    public DeliveryWindow resolve(String timezoneName, int localHourStart, int localHourEnd, LocalDate onDate) {
        if (onDate == null) {
            throw new IllegalArgumentException("onDate must not be null");
        }
        if (localHourStart < 0 || localHourStart > 24 || localHourEnd < 0 || localHourEnd > 24) {
            throw new InvalidWindowException(
                "Window hours must be within [0, 24], got " + localHourStart + "-" + localHourEnd);
        }
        if (localHourStart >= localHourEnd) {
            throw new InvalidWindowException(
                "Window start must be before end, got " + localHourStart + "-" + localHourEnd);
        }
        ZoneId zone = zoneOf(timezoneName);

        ZonedDateTime start = toZoned(onDate, localHourStart, zone);
        ZonedDateTime end = toZoned(onDate, localHourEnd, zone);
        if (!start.toInstant().isBefore(end.toInstant())) {
            // only reachable for a one-hour window that falls entirely in a DST gap
            throw new InvalidWindowException("Window " + localHourStart + "-" + localHourEnd
                + " on " + onDate + " in " + timezoneName + " is empty in UTC");
        }
        return new DeliveryWindow(start.toInstant(), end.toInstant());
    }

    /**
     * Parses a zone id, mapping parse failures to {@link UnknownTimezoneException}.
     */
    public ZoneId zoneOf(String timezoneName) {
        if (timezoneName == null || timezoneName.isBlank()) {
            throw new UnknownTimezoneException(String.valueOf(timezoneName), null);
        }
        try {
            return ZoneId.of(timezoneName);
        } catch (DateTimeException e) {
            throw new UnknownTimezoneException(timezoneName, e);
        }
    }

    private static ZonedDateTime toZoned(LocalDate date, int hour, ZoneId zone) {
        LocalDateTime local = hour == 24
            ? date.plusDays(1).atStartOfDay()
            : LocalDateTime.of(date, LocalTime.of(hour, 0));
        return ZonedDateTime.of(local, zone);
    }
}

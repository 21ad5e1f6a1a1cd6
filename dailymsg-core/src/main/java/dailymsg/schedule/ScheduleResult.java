package dailymsg.schedule;

/**
 * Per-call breakdown of {@link Scheduler#scheduleDayDetailed}.
 *
 * @param created         rows inserted by this call
 * @param skippedExisting subscribers that already had a row for the day, including lost insert races
 * @param skippedInvalid  subscribers with an unknown timezone, an invalid window, or a store failure
 * @param skippedInactive inactive subscribers
 * @param skippedClosed   subscribers whose window had already closed when scheduling ran
 */
public record ScheduleResult(int created, int skippedExisting, int skippedInvalid,
                             int skippedInactive, int skippedClosed) {

    public int skipped() {
        return skippedExisting + skippedInvalid + skippedInactive + skippedClosed;
    }

    public int total() {
        return created + skipped();
    }
}

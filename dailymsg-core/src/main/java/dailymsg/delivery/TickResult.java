package dailymsg.delivery;

/**
 * Counters for one {@link DeliveryWorker#tick()}.
 *
 * @param claimed   rows this worker claimed
 * @param sent      rows sent
 * @param retried   rows returned to PENDING after a failed attempt
 * @param failed    rows finalized FAILED (attempts exhausted or window elapsed)
 * @param cancelled claimed rows found cancelled or whose subscriber is gone
 * @param throttled rows released because a rate limit denied a token
 * @param recovered stale IN_PROGRESS claims released or failed before polling
 */
public record TickResult(int claimed, int sent, int retried, int failed, int cancelled,
                         int throttled, int recovered) {

  private static final TickResult EMPTY = new TickResult(0, 0, 0, 0, 0, 0, 0);

  public static TickResult empty() {
    return EMPTY;
  }
}

package dailymsg.schedule;

import dailymsg.SubscriberDirectory;
import dailymsg.model.ScheduledDelivery;
import dailymsg.model.Subscriber;
import dailymsg.spi.ConnectionProvider;
import dailymsg.spi.DeliveryStore;
import dailymsg.spi.MetricsExporter;
import dailymsg.time.DeliveryWindow;
import dailymsg.time.TimezoneException;
import dailymsg.time.TimezoneResolver;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates one PENDING delivery row per active subscriber for a calendar day.
 *
 * <p>The send time is drawn uniformly from the part of the subscriber's local window
 * that is still ahead, {@code [max(windowStart, now), windowEnd)}, converted to UTC with
 * the zone rules in force on that day. A subscriber whose window has already closed is
 * skipped rather than scheduled late.
 *
 * <p>Scheduling is idempotent: a subscriber that already has a row for the day, in any
 * status, is skipped, and a unique key on {@code (subscriber, day)} makes a concurrent
 * second scheduler lose its insert instead of creating a duplicate. Re-running a partially
 * failed call therefore only fills the gaps.
 *
 * <p>No external API is called here; generation and sending belong to
 * {@link dailymsg.delivery.DeliveryWorker}. Create instances via {@link #builder()}.
 */
public final class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final ConnectionProvider connectionProvider;
    private final DeliveryStore deliveryStore;
    private final SubscriberDirectory subscriberDirectory;
    private final TimezoneResolver timezoneResolver;
    private final Clock clock;
    private final Random random;
    private final MetricsExporter metrics;

    private Scheduler(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
        this.subscriberDirectory = builder.subscriberDirectory;
        this.timezoneResolver = builder.timezoneResolver != null ? builder.timezoneResolver : new TimezoneResolver();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.random = builder.random;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Schedules every subscriber returned by
     * {@link SubscriberDirectory#listActiveSubscribers()}.
     *
     * @param day the calendar day to schedule
     * @return number of rows created
     * @throws SchedulingException   if the day is null or the directory or store is unreachable
     * @throws IllegalStateException if no subscriber directory was configured
     */
    public int scheduleDay(LocalDate day) {
        if (subscriberDirectory == null) {
            throw new IllegalStateException("No SubscriberDirectory configured");
        }
        if (day == null) {
            throw new SchedulingException("day must not be null");
        }
        List<Subscriber> subscribers;
        try {
            subscribers = subscriberDirectory.listActiveSubscribers();
        } catch (RuntimeException e) {
            throw new SchedulingException("Failed to list active subscribers", e);
        }
        return scheduleDay(subscribers, day);
    }

    /**
     * Schedules the given subscribers for {@code day}.
     *
     * @return number of rows created
     * @see #scheduleDayDetailed(Collection, LocalDate)
     */
    public int scheduleDay(Collection<Subscriber> subscribers, LocalDate day) {
        return scheduleDayDetailed(subscribers, day).created();
    }

    /**
     * Schedules the given subscribers for {@code day} and reports why each one that was
     * not scheduled was skipped.
     *
     * <p>Per-subscriber problems (unknown timezone, invalid window, a failed insert) skip
     * that subscriber with a warning; only invalid input fails the whole call.
     *
     * @param subscribers subscribers to schedule; inactive ones are skipped
     * @param day         subscriber-local calendar day
     * @return the breakdown for this call
     * @throws SchedulingException if {@code subscribers} or {@code day} is null, the
     *                             collection holds a null element or a repeated subscriber
     *                             id, or no connection can be obtained
     */
    public ScheduleResult scheduleDayDetailed(Collection<Subscriber> subscribers, LocalDate day) {
        validate(subscribers, day);
        Tally tally = new Tally();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (Subscriber subscriber : subscribers) {
                tally.add(scheduleOne(conn, subscriber, day));
            }
        } catch (SQLException e) {
            throw new SchedulingException("Failed to obtain connection for scheduling " + day, e);
        }
        ScheduleResult result = tally.toResult();
        logger.log(Level.INFO, "Scheduled {0}: {1}", new Object[]{day, result});
        return result;
    }

    private static void validate(Collection<Subscriber> subscribers, LocalDate day) {
        if (subscribers == null) {
            throw new SchedulingException("subscribers must not be null");
        }
        if (day == null) {
            throw new SchedulingException("day must not be null");
        }
        Set<String> seen = new HashSet<>();
        for (Subscriber subscriber : subscribers) {
            if (subscriber == null) {
                throw new SchedulingException("subscribers must not contain null elements");
            }
            if (!seen.add(subscriber.id())) {
                throw new SchedulingException("Duplicate subscriber id: " + subscriber.id());
            }
        }
    }

    private Skip scheduleOne(Connection conn, Subscriber subscriber, LocalDate day) {
        if (!subscriber.active()) {
            return Skip.INACTIVE;
        }
        DeliveryWindow window;
        try {
            window = timezoneResolver.resolve(subscriber.timezone(),
                subscriber.windowStartHour(), subscriber.windowEndHour(), day);
        } catch (TimezoneException e) {
            logger.log(Level.WARNING, "Skipping subscriber " + subscriber.id() + ": " + e.getMessage());
            return Skip.INVALID;
        }

        try {
            if (deliveryStore.existsForDay(conn, subscriber.id(), day)) {
                logger.log(Level.FINE, "Subscriber {0} already scheduled for {1}", new Object[]{subscriber.id(), day});
                return Skip.EXISTING;
            }

            Instant now = clock.instant();
            Instant earliest = window.start().isAfter(now) ? window.start() : now;
            long spanMs = Duration.between(earliest, window.end()).toMillis();
            if (spanMs <= 0) {
                logger.log(Level.WARNING, "Skipping subscriber {0}: window for {1} closed at {2}",
                    new Object[]{subscriber.id(), day, window.end()});
                return Skip.CLOSED;
            }
            Instant scheduledAt = earliest.truncatedTo(ChronoUnit.MILLIS).plusMillis(nextOffsetMs(spanMs));

            ScheduledDelivery delivery = ScheduledDelivery.pending(UUID.randomUUID().toString(),
                subscriber.id(), day, scheduledAt, window.end(), now);
            if (!deliveryStore.insertIfAbsent(conn, delivery)) {
                logger.log(Level.FINE, "Lost insert race for subscriber {0} on {1}", new Object[]{subscriber.id(), day});
                return Skip.EXISTING;
            }
            logger.log(Level.FINE, "Scheduled subscriber {0} on {1} at {2}",
                new Object[]{subscriber.id(), day, scheduledAt});
            return null;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to schedule subscriber " + subscriber.id() + " for " + day, e);
            return Skip.INVALID;
        }
    }

    private long nextOffsetMs(long boundMs) {
        return random != null ? random.nextLong(boundMs) : ThreadLocalRandom.current().nextLong(boundMs);
    }

    private enum Skip {
        EXISTING, INVALID, INACTIVE, CLOSED
    }

    private final class Tally {
        int created;
        int existing;
        int invalid;
        int inactive;
        int closed;

        void add(Skip skip) {
            if (skip == null) {
                created++;
                metrics.incrementScheduled();
                return;
            }
            metrics.incrementScheduleSkipped();
            switch (skip) {
                case EXISTING:
                    existing++;
                    break;
                case INVALID:
                    invalid++;
                    break;
                case INACTIVE:
                    inactive++;
                    break;
                default:
                    closed++;
                    break;
            }
        }

        ScheduleResult toResult() {
            return new ScheduleResult(created, existing, invalid, inactive, closed);
        }
    }

    /**
     * Builder for {@link Scheduler}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private DeliveryStore deliveryStore;
        private SubscriberDirectory subscriberDirectory;
        private TimezoneResolver timezoneResolver;
        private Clock clock;
        private Random random;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * <b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder deliveryStore(DeliveryStore deliveryStore) {
            this.deliveryStore = deliveryStore;
            return this;
        }

        /**
         * Sets the directory read by {@link Scheduler#scheduleDay(LocalDate)}.
         *
         * <p>Optional when subscribers are always passed explicitly.
         */
        public Builder subscriberDirectory(SubscriberDirectory subscriberDirectory) {
            this.subscriberDirectory = subscriberDirectory;
            return this;
        }

        /**
         * Optional. Defaults to a new {@link TimezoneResolver}.
         */
        public Builder timezoneResolver(TimezoneResolver timezoneResolver) {
            this.timezoneResolver = timezoneResolver;
            return this;
        }

        /**
         * Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the source used to pick send times, for reproducible tests.
         *
         * <p>Optional. Defaults to {@link ThreadLocalRandom}.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        public Scheduler build() {
            return new Scheduler(this);
        }
    }
}

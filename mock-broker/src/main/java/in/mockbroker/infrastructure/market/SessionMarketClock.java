package in.mockbroker.infrastructure.market;

import in.mockbroker.application.port.output.MarketClock;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Set;

/**
 * Session Clock - market open check for a daily trading session.
 *
 * NSE Regular Session: 09:15 AM - 03:30 PM IST, Monday to Friday.
 * Start and end are both inclusive. Dates in the holiday set are closed all day.
 */
public final class SessionMarketClock implements MarketClock {
    public static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    public static final LocalTime NSE_SESSION_START = LocalTime.of(9, 15);
    public static final LocalTime NSE_SESSION_END = LocalTime.of(15, 30);

    private static final MarketClock ALWAYS_OPEN = ts -> true;
    private static final MarketClock ALWAYS_CLOSED = ts -> false;

    private final ZoneId zone;
    private final LocalTime sessionStart;
    private final LocalTime sessionEnd;
    private final Set<LocalDate> holidays;

    public SessionMarketClock(ZoneId zone, LocalTime sessionStart, LocalTime sessionEnd, Set<LocalDate> holidays) {
        if (zone == null || sessionStart == null || sessionEnd == null) {
            throw new IllegalArgumentException("zone, sessionStart and sessionEnd cannot be null");
        }
        if (!sessionStart.isBefore(sessionEnd)) {
            throw new IllegalArgumentException("sessionStart must be before sessionEnd");
        }
        this.zone = zone;
        this.sessionStart = sessionStart;
        this.sessionEnd = sessionEnd;
        this.holidays = holidays != null ? Set.copyOf(holidays) : Set.of();
    }

    /**
     * NSE regular session with no holidays.
     */
    public static SessionMarketClock nse() {
        return nse(Set.of());
    }

    public static SessionMarketClock nse(Set<LocalDate> holidays) {
        return new SessionMarketClock(IST, NSE_SESSION_START, NSE_SESSION_END, holidays);
    }

    public static MarketClock alwaysOpen() {
        return ALWAYS_OPEN;
    }

    public static MarketClock alwaysClosed() {
        return ALWAYS_CLOSED;
    }

    @Override
    public boolean isOpen(Instant timestamp) {
        ZonedDateTime local = timestamp.atZone(zone);
        LocalDate date = local.toLocalDate();
        DayOfWeek day = date.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY || holidays.contains(date)) {
            return false;
        }
        Instant start = getSessionStart(date);
        Instant end = getSessionEnd(date);
        return !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }

    public Instant getSessionStart(LocalDate date) {
        return ZonedDateTime.of(date, sessionStart, zone).toInstant();
    }

    public Instant getSessionEnd(LocalDate date) {
        return ZonedDateTime.of(date, sessionEnd, zone).toInstant();
    }
}

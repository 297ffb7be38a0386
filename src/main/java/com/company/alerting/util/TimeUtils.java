package com.company.alerting.util;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

public class TimeUtils {

    private static final LocalTime DEFAULT_HANDOFF = LocalTime.of(9, 0);

    public static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    /**
     * Resolve a schedule timezone; unknown or blank ids fall back to UTC.
     */
    public static ZoneId zoneOrUtc(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            return ZoneOffset.UTC;
        }
    }

    /**
     * Parse "HH:mm" or "HH:mm:ss"; anything unparsable means the 09:00 default.
     */
    public static LocalTime parseHandoff(String handoff) {
        if (handoff == null || handoff.isBlank()) {
            return DEFAULT_HANDOFF;
        }
        try {
            return LocalTime.parse(handoff.trim());
        } catch (DateTimeParseException e) {
            return DEFAULT_HANDOFF;
        }
    }

    public static String formatHandoff(LocalTime handoff) {
        LocalTime t = handoff != null ? handoff : DEFAULT_HANDOFF;
        return String.format("%02d:%02d", t.getHour(), t.getMinute());
    }

    public static String formatDuration(Duration duration) {
        if (duration == null) return null;

        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        long seconds = duration.toSecondsPart();

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}

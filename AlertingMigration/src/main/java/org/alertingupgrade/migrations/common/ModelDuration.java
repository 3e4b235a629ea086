package org.alertingupgrade.migrations.common;

import java.io.IOException;
import java.time.Duration;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import lombok.experimental.UtilityClass;

/**
 * Prometheus style durations such as {@code 1h30m} or {@code 52w}, the notation alerting configuration
 * uses for repeat intervals and pending periods.
 */
@UtilityClass
public class ModelDuration {
    private static final long MS_SECOND = 1000L;
    private static final long MS_MINUTE = 60 * MS_SECOND;
    private static final long MS_HOUR = 60 * MS_MINUTE;
    private static final long MS_DAY = 24 * MS_HOUR;
    private static final long MS_WEEK = 7 * MS_DAY;
    private static final long MS_YEAR = 365 * MS_DAY;

    private static final long[] UNIT_MILLIS = {MS_YEAR, MS_WEEK, MS_DAY, MS_HOUR, MS_MINUTE, MS_SECOND, 1L};
    private static final String[] UNIT_NAMES = {"y", "w", "d", "h", "m", "s", "ms"};

    private static final Pattern DURATION_PATTERN = Pattern.compile(
        "^(?:(\\d+)y)?(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$");

    public static String format(Duration duration) {
        long ms = duration.toMillis();
        if (ms == 0) {
            return "0s";
        }
        var sb = new StringBuilder();
        for (int i = 0; i < UNIT_MILLIS.length; i++) {
            if (ms >= UNIT_MILLIS[i]) {
                sb.append(ms / UNIT_MILLIS[i]).append(UNIT_NAMES[i]);
                ms %= UNIT_MILLIS[i];
            }
        }
        return sb.toString();
    }

    /**
     * @throws IllegalArgumentException when the text is not a non-empty duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("empty duration string");
        }
        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        var matcher = DURATION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("not a valid duration string: \"" + text + "\"");
        }
        long total = 0;
        for (int i = 0; i < UNIT_MILLIS.length; i++) {
            var group = matcher.group(i + 1);
            if (group != null) {
                total += Long.parseLong(group) * UNIT_MILLIS[i];
            }
        }
        return Duration.ofMillis(total);
    }

    public static class Serializer extends JsonSerializer<Duration> {
        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(format(value));
        }
    }

    public static class Deserializer extends JsonDeserializer<Duration> {
        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            try {
                return parse(p.getValueAsString());
            } catch (IllegalArgumentException e) {
                return (Duration) ctxt.handleWeirdStringValue(Duration.class, p.getValueAsString(), e.getMessage());
            }
        }
    }
}

package datahandler.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Parses the duration strings used for max lag and bucket width ("500ms", "1s", "0.5s", "2m") and renders millisecond
 * durations as Flux duration literals.
 */
public class DurationParser {

    private static final Pattern DURATION = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m)$");

    private DurationParser() {}

    /**
     * @return the duration in milliseconds, always greater than zero
     * @throws IllegalArgumentException
     *             if the value is blank, has an unsupported suffix, or is shorter than one millisecond
     */
    public static long toMillis(String duration) {
        if (StringUtils.isBlank(duration)) {
            throw new IllegalArgumentException("duration must not be blank");
        }
        Matcher m = DURATION.matcher(duration.trim().toLowerCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported duration: " + duration + ", expected a number followed by ms, s or m");
        }
        BigDecimal amount = new BigDecimal(m.group(1));
        long unitMillis;
        switch (m.group(2)) {
            case "ms":
                unitMillis = 1;
                break;
            case "s":
                unitMillis = TimeUnit.SECONDS.toMillis(1);
                break;
            default:
                unitMillis = TimeUnit.MINUTES.toMillis(1);
        }
        long millis;
        try {
            millis = amount.multiply(BigDecimal.valueOf(unitMillis)).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("duration too large: " + duration, e);
        }
        if (millis < 1) {
            throw new IllegalArgumentException("duration must be at least 1ms: " + duration);
        }
        return millis;
    }

    /**
     * Renders a positive millisecond count in the largest Flux unit that represents it exactly.
     */
    public static String toFluxDuration(long millis) {
        if (millis < 1) {
            throw new IllegalArgumentException("duration must be at least 1ms");
        }
        if (millis % TimeUnit.DAYS.toMillis(1) == 0) {
            return (millis / TimeUnit.DAYS.toMillis(1)) + "d";
        }
        if (millis % TimeUnit.HOURS.toMillis(1) == 0) {
            return (millis / TimeUnit.HOURS.toMillis(1)) + "h";
        }
        if (millis % TimeUnit.MINUTES.toMillis(1) == 0) {
            return (millis / TimeUnit.MINUTES.toMillis(1)) + "m";
        }
        if (millis % TimeUnit.SECONDS.toMillis(1) == 0) {
            return (millis / TimeUnit.SECONDS.toMillis(1)) + "s";
        }
        return millis + "ms";
    }

    public static String toFluxDuration(Duration duration) {
        return toFluxDuration(duration.toMillis());
    }
}

package datahandler.util;

import static org.junit.Assert.assertEquals;

import java.time.Duration;

import org.junit.Test;

public class DurationParserTest {

    @Test
    public void testToMillis() {
        assertEquals(1000, DurationParser.toMillis("1s"));
        assertEquals(500, DurationParser.toMillis("500ms"));
        assertEquals(500, DurationParser.toMillis("0.5s"));
        assertEquals(120000, DurationParser.toMillis("2m"));
        assertEquals(1500, DurationParser.toMillis(" 1.5 S "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedSuffix() {
        DurationParser.toMillis("1h");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooShort() {
        DurationParser.toMillis("0.0001s");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlank() {
        DurationParser.toMillis("");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooLarge() {
        DurationParser.toMillis("99999999999999999999m");
    }

    @Test
    public void testToFluxDuration() {
        assertEquals("1s", DurationParser.toFluxDuration(1000));
        assertEquals("500ms", DurationParser.toFluxDuration(500));
        assertEquals("1500ms", DurationParser.toFluxDuration(1500));
        assertEquals("2m", DurationParser.toFluxDuration(120000));
        assertEquals("30d", DurationParser.toFluxDuration(Duration.ofDays(30)));
        assertEquals("36h", DurationParser.toFluxDuration(Duration.ofHours(36)));
    }
}

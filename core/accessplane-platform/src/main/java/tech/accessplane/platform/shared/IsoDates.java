package tech.accessplane.platform.shared;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Lenient reading of the ISO dates stored on items. Stored values are either
 * plain dates ({@code 2025-01-31}) or full timestamps
 * ({@code 2025-01-31T00:00:00.000Z}); only the date part is significant.
 */
public final class IsoDates {

    private IsoDates() {
    }

    /**
     * @return the date, or null when the value is absent or unparseable
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}

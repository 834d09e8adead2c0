package com.portfolio.analytics.pulse.util;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Locale;

/**
 * Number and date rendering shared by risk explanations, impacts and narratives.
 */
public final class Formats {

    private Formats() {
    }

    /**
     * 185000 -> "185,000"
     */
    public static String currency(double amount) {
        return String.format(Locale.ROOT, "%,.0f", amount);
    }

    /**
     * 0.925 -> "92%". Truncates, so 99.9% spend never reads as 100%.
     */
    public static String percent(double ratio) {
        return (long) Math.floor(ratio * 100 + 1e-9) + "%";
    }

    public static String date(LocalDate date) {
        return date != null ? date.toString() : "N/A";
    }

    public static String change(Object before, Object after) {
        return render(before) + " → " + render(after);
    }

    public static String plural(int count, String singular, String plural) {
        return count + " " + (count == 1 ? singular : plural);
    }

    public static String plural(Collection<?> items, String singular, String plural) {
        return plural(items.size(), singular, plural);
    }

    private static String render(Object value) {
        if (value == null) {
            return "N/A";
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        return String.valueOf(value);
    }
}

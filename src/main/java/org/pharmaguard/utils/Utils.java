package org.pharmaguard.utils;

import org.apache.commons.lang3.StringUtils;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Precondition checks and small shared helpers used throughout the pipeline.
 */
public final class Utils {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("MMMM d, yyyy 'at' h:mm:ss a z");

    private Utils() {}

    /**
     * @return {@code object}
     * @throws IllegalArgumentException if {@code object} is null
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(final String string, final String message){
        nonNull(string, "The string is null: " + message);
        if(string.isEmpty()){
            throw new IllegalArgumentException("The string is empty: " + message);
        }
        return string;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is null or empty
     */
    public static <I, T extends Collection<I>> T nonEmpty(final T collection, final String message){
        nonNull(collection, "The collection is null: " + message);
        if(collection.isEmpty()){
            throw new IllegalArgumentException("The collection is empty: " + message);
        }
        return collection;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is null or holds a null element
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        Utils.nonNull(collection, message);
        if (collection.stream().anyMatch(v -> v == null)){
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Splits a free-text, comma separated list (e.g. "fluoxetine, Omeprazole ,") into its trimmed, non-blank
     * entries, preserving order and dropping repeats. A {@code null} or blank input yields an empty list.
     */
    public static List<String> splitCommaSeparated(final String text) {
        if (StringUtils.isBlank(text)) {
            return Collections.emptyList();
        }
        final Set<String> entries = new LinkedHashSet<>();
        for (final String token : text.split(",")) {
            final String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                entries.add(trimmed);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Clamps {@code value} into [0,1]. NaN is treated as 0.
     */
    public static double clampToUnitInterval(final double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Rounds half-up to the given number of decimal places. Non-decreasing in {@code value}.
     */
    public static double round(final double value, final int places) {
        validateArg(places >= 0, "places must be non-negative");
        final double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    /**
     * Return the given {@code dateTime} formatted as string for display.
     */
    public static String getDateTimeForDisplay(final ZonedDateTime dateTime) {
        return dateTime.format(DATE_TIME_FORMATTER);
    }

    /**
     * Create a new string that's n copies of c
     */
    public static String dupChar(final char c, final int nCopies) {
        final char[] chars = new char[nCopies];
        Arrays.fill(chars, c);
        return new String(chars);
    }

    /**
     * Forces the JVM locale to US English so number formatting in reports never depends on the host.
     */
    public static void forceJVMLocaleToUSEnglish() {
        Locale.setDefault(Locale.US);
    }
}

package com.pallet.checkdigit.normalizer;

import com.pallet.checkdigit.model.StationKey;
import com.pallet.checkdigit.model.ValidationClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets operator shorthand for station keys.
 *
 * Accepted notations for aisle 58, position 01 in building 3:
 * <ul>
 *   <li>canonical - {@code 58-01}</li>
 *   <li>compact   - {@code 5801}</li>
 *   <li>full      - {@code 3-58-01-1} or {@code 03-58-01-01}; building prefix and level
 *                   suffix are dropped, the building always comes from the caller</li>
 * </ul>
 *
 * Every method is total: any string is accepted and nothing is thrown. Unusable input
 * is reported through {@link ValidationClass}, never as an exception.
 */
public final class StationNormalizer {

    /** Building used in suggestion examples when the caller does not supply one. */
    public static final int EXAMPLE_BUILDING = 3;

    private static final int MAX_SUGGESTIONS = 3;

    private static final Pattern CANONICAL = Pattern.compile("[0-9]{2}-[0-9]{2}");
    private static final Pattern COMPACT = Pattern.compile("([0-9]{2})([0-9]{2})");
    private static final Pattern FULL = Pattern.compile("[0-9]{1,2}-([0-9]{2})-([0-9]{2})-[0-9]{1,2}");
    private static final Pattern FULL_NO_SUFFIX = Pattern.compile("[0-9]{1,2}-([0-9]{2})-([0-9]{2})");
    private static final Pattern AISLE_THEN_ONE_DIGIT = Pattern.compile("([0-9]{2})-([0-9])");
    private static final Pattern TRAILING_DASH = Pattern.compile("([0-9]{1,2})-");
    private static final Pattern THREE_DIGITS = Pattern.compile("([0-9]{2})([0-9])");
    private static final Pattern PREFIX_THEN_AISLE = Pattern.compile("([0-9])-([0-9]{1,2})");
    private static final Pattern NOT_DIGIT_OR_DASH = Pattern.compile("[^0-9-]");

    private StationNormalizer() {
    }

    /**
     * Classifies raw input. First matching rule wins; fully-qualified shapes are checked
     * before the shorter partial shapes they contain.
     *
     * @param raw operator input, may be null
     * @return the classification, never null
     */
    public static ValidationClass classify(String raw) {
        String input = raw == null ? "" : raw.strip();

        if (input.isEmpty()) {
            return ValidationClass.EMPTY;
        }
        if (CANONICAL.matcher(input).matches()) {
            return ValidationClass.COMPLETE_CANONICAL;
        }
        if (COMPACT.matcher(input).matches()) {
            return ValidationClass.COMPLETE_COMPACT;
        }
        if (FULL.matcher(input).matches()) {
            return ValidationClass.COMPLETE_FULL;
        }
        if (FULL_NO_SUFFIX.matcher(input).matches()) {
            return ValidationClass.PARTIAL_FULL;
        }
        if (input.length() < 3) {
            return ValidationClass.TOO_SHORT;
        }
        if (AISLE_THEN_ONE_DIGIT.matcher(input).matches()
                || TRAILING_DASH.matcher(input).matches()
                || THREE_DIGITS.matcher(input).matches()) {
            return ValidationClass.PARTIAL_FORMAT;
        }
        if (NOT_DIGIT_OR_DASH.matcher(input).find()) {
            return ValidationClass.INVALID_CHARACTERS;
        }
        return ValidationClass.INVALID_FORMAT;
    }

    /**
     * Converts input to the canonical {@code AA-PP} text where its shape allows it.
     *
     * Everything but digits and dashes is stripped first. Shapes that cannot be
     * canonicalised come back cleaned but otherwise unchanged; callers reject them
     * through {@link #classify(String)}. Idempotent on its own output.
     *
     * @param raw operator input, may be null
     * @return canonical key text, or the cleaned input
     */
    public static String normalize(String raw) {
        String cleaned = raw == null ? "" : NOT_DIGIT_OR_DASH.matcher(raw).replaceAll("");

        if (CANONICAL.matcher(cleaned).matches()) {
            return cleaned;
        }
        Matcher compact = COMPACT.matcher(cleaned);
        if (compact.matches()) {
            return compact.group(1) + "-" + compact.group(2);
        }
        Matcher full = FULL.matcher(cleaned);
        if (full.matches()) {
            return full.group(1) + "-" + full.group(2);
        }
        Matcher partialFull = FULL_NO_SUFFIX.matcher(cleaned);
        if (partialFull.matches()) {
            return partialFull.group(1) + "-" + partialFull.group(2);
        }
        return cleaned;
    }

    /**
     * Resolves input to a key, but only when {@link #classify(String)} says it is complete.
     *
     * @param raw operator input
     * @return the key, or empty for partial or malformed input
     */
    public static Optional<StationKey> toKey(String raw) {
        if (!classify(raw).isResolvable()) {
            return Optional.empty();
        }
        return StationKey.parse(normalize(raw));
    }

    /**
     * Example completions for partial input, using {@link #EXAMPLE_BUILDING} as the prefix.
     *
     * @see #suggest(String, int)
     */
    public static List<String> suggest(String raw) {
        return suggest(raw, EXAMPLE_BUILDING);
    }

    /**
     * Up to three example strings showing how the given partial input could be completed.
     * Advisory only: no attempt is made to list every completion, and complete or invalid
     * input gets no suggestions.
     *
     * @param raw        operator input
     * @param buildingId building used as prefix in full-format examples
     * @return at most three suggestions, possibly empty
     */
    public static List<String> suggest(String raw, int buildingId) {
        String input = raw == null ? "" : raw.strip();
        List<String> suggestions = new ArrayList<>();
        Matcher m;

        if (input.isEmpty()) {
            suggestions.add(buildingId + "-40-15-1");
            suggestions.add("4015");
            suggestions.add("40-15");
        } else if (input.length() == 1 && isDigits(input)) {
            suggestions.add(input + "-40-15-1");
            suggestions.add(input + "0-15");
        } else if (input.length() == 2 && isDigits(input)) {
            suggestions.add(input + "-15");
            suggestions.add(input + "15");
            suggestions.add(buildingId + "-" + input + "-15-1");
        } else if ((m = THREE_DIGITS.matcher(input)).matches()) {
            suggestions.add(m.group(1) + m.group(2) + "1");
            suggestions.add(m.group(1) + "-" + m.group(2) + "1");
        } else if ((m = AISLE_THEN_ONE_DIGIT.matcher(input)).matches()) {
            suggestions.add(m.group(1) + "-0" + m.group(2));
            suggestions.add(m.group(1) + "-" + m.group(2) + "0");
        } else if ((m = PREFIX_THEN_AISLE.matcher(input)).matches()) {
            String aisle = m.group(2).length() == 1 ? "0" + m.group(2) : m.group(2);
            suggestions.add(m.group(1) + "-" + aisle + "-15-1");
        } else if ((m = TRAILING_DASH.matcher(input)).matches()) {
            String aisle = m.group(1).length() == 1 ? "0" + m.group(1) : m.group(1);
            suggestions.add(aisle + "-15");
            suggestions.add(buildingId + "-" + aisle + "-15-1");
        } else if ((m = FULL_NO_SUFFIX.matcher(input)).matches()) {
            suggestions.add(input + "-1");
        }

        return suggestions.size() > MAX_SUGGESTIONS ? suggestions.subList(0, MAX_SUGGESTIONS) : suggestions;
    }

    /**
     * Short operator-facing form with leading zeros dropped: {@code 58-01 -> 58-1},
     * {@code 00-00 -> 0-0}.
     *
     * @param key station key
     * @return display text
     */
    public static String displayForm(StationKey key) {
        return Integer.parseInt(key.aisle()) + "-" + Integer.parseInt(key.position());
    }

    /**
     * Verbose form the forklift terminal shows, e.g. {@code 3-58-01-1}.
     *
     * @param buildingId building prefix
     * @param key        station key
     * @return full-format text
     */
    public static String fullForm(int buildingId, StationKey key) {
        return buildingId + "-" + key.canonical() + "-1";
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}

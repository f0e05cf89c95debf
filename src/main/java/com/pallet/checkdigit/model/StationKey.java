package com.pallet.checkdigit.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonical identifier of a pick/drop location: a two-digit aisle and a two-digit position.
 *
 * The textual form is always {@code "AA-PP"} (e.g. {@code "58-01"}). The key carries no
 * building; the same key names different shelves in different buildings, so every lookup
 * pairs it with a building id.
 *
 * {@code "00"} is a valid aisle or position.
 */
public record StationKey(String aisle, String position) {

    private static final Pattern TWO_DIGITS = Pattern.compile("[0-9]{2}");
    private static final Pattern CANONICAL = Pattern.compile("([0-9]{2})-([0-9]{2})");

    public StationKey {
        if (aisle == null || !TWO_DIGITS.matcher(aisle).matches()) {
            throw new IllegalArgumentException("aisle must be exactly two digits: " + aisle);
        }
        if (position == null || !TWO_DIGITS.matcher(position).matches()) {
            throw new IllegalArgumentException("position must be exactly two digits: " + position);
        }
    }

    /**
     * Parses the canonical {@code AA-PP} form. Any other shape yields empty.
     *
     * @param text canonical key text
     * @return the key if {@code text} is canonical
     */
    public static Optional<StationKey> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var m = CANONICAL.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new StationKey(m.group(1), m.group(2)));
    }

    /** @return the canonical {@code AA-PP} text */
    public String canonical() {
        return aisle + "-" + position;
    }

    @Override
    public String toString() {
        return canonical();
    }
}

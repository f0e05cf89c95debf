package com.pallet.checkdigit.model;

/**
 * Result kind of a station lookup.
 *
 * <ul>
 *   <li>FOUND          - the key exists in the building, a check digit is attached</li>
 *   <li>NOT_FOUND      - the key is well formed but unknown; the operator enters it manually</li>
 *   <li>NOT_RESOLVABLE - the input is not complete enough to look up yet</li>
 * </ul>
 */
public enum LookupStatus {
    FOUND,
    NOT_FOUND,
    NOT_RESOLVABLE
}

package com.pallet.checkdigit.session;

/**
 * Where a lookup session stands with respect to its current input.
 *
 * <ul>
 *   <li>IDLE       - nothing typed</li>
 *   <li>TYPING     - input present but not complete enough to look up</li>
 *   <li>LOOKING_UP - a lookup for the current input is in flight</li>
 *   <li>FOUND      - the current input resolved to a check digit</li>
 *   <li>NOT_FOUND  - the current input is a valid key with no stored check digit</li>
 *   <li>FAILED     - the lookup could not be completed; the operator may retry</li>
 * </ul>
 */
public enum LookupPhase {
    IDLE,
    TYPING,
    LOOKING_UP,
    FOUND,
    NOT_FOUND,
    FAILED
}

package com.pallet.checkdigit.session;

/**
 * Identifies one issued lookup together with the exact building and input it was issued for.
 *
 * @param id         session-unique, increasing ticket number
 * @param buildingId building at issue time
 * @param input      input text at issue time
 */
public record LookupTicket(long id, int buildingId, String input) {
}

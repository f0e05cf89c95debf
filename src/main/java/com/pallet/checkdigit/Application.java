package com.pallet.checkdigit;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the station check-digit service.
 *
 * Forklift terminals send station shorthand (58-01, 5801, 3-58-01-1) and get the
 * check digit painted on that station back.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting station check-digit service...");
        Micronaut.run(Application.class, args);
    }
}

package io.datastoreadmin.configurator;

import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Reports the datastore write actions performed while configuring a cluster, for operators
 * following along (or reviewing a dry run).
 */
@Slf4j
public class ActionReporter {

    private static final String SEPARATOR = "=".repeat(80);

    private final PrintStream output;

    public ActionReporter(PrintStream output) {
        this.output = output;
    }

    public void reportAction(String message) {
        String trimmed = message.stripTrailing();
        log.info("Datastore action: {}", trimmed);
        output.println(trimmed);
        output.println(SEPARATOR);
    }
}

package com.phillippitts.fleetdump.service.monitor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the output of {@code ls <coredump directory>} run on a device.
 */
final class CoredumpListing {

    private CoredumpListing() {}

    /**
     * Returns the entries that look like coredumps: non-blank lines that are not {@code ls}
     * error messages and mention "core".
     */
    static List<String> coredumpFiles(String lsOutput) {
        List<String> files = new ArrayList<>();
        if (lsOutput == null || lsOutput.isBlank()) {
            return files;
        }
        for (String raw : lsOutput.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("ls:")) {
                continue;
            }
            if (line.toLowerCase(Locale.ROOT).contains("core")) {
                files.add(line);
            }
        }
        return files;
    }
}

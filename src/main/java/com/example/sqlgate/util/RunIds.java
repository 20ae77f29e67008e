package com.example.sqlgate.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ThreadLocalRandom;

public final class RunIds {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private RunIds() {
    }

    /**
     * {@code <prefix>_yyyyMMdd_HHmmss_<8 hex>}, UTC.
     */
    public static String next(String prefix, Clock clock) {
        return prefix + "_" + FORMAT.format(clock.instant()) + "_"
                + String.format("%08x", ThreadLocalRandom.current().nextInt());
    }
}

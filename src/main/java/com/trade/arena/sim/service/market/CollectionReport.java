package com.trade.arena.sim.service.market;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a collection batch: how many securities were written, how many failed and why.
 */
public record CollectionReport(int updated, int failed, Map<String, String> failures) {

    public CollectionReport {
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    static Tally tally() {
        return new Tally();
    }

    static final class Tally {
        private int updated;
        private final Map<String, String> failures = new LinkedHashMap<>();

        void success() {
            updated++;
        }

        void failure(String code, String reason) {
            failures.put(code, reason);
        }

        CollectionReport report() {
            return new CollectionReport(updated, failures.size(), failures);
        }
    }
}

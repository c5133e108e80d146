package com.rms.relay.core.reconcile;

import java.util.List;

/**
 * Outcome of one desired-state pass.
 *
 * @param applied entry keys that were registered (including no-op registrations)
 * @param skipped entry keys that were rejected, with the reason
 */
public record ReconcileReport(List<String> applied, List<Skipped> skipped) {

    public record Skipped(String key, String reason) {
    }

    public ReconcileReport {
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
    }

    public boolean isClean() {
        return skipped.isEmpty();
    }
}

package com.gnovoa.scheduler.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running per-team slot debt for one schedule generation.
 *
 * <p>Positive debt means the team has had worse slots than average so far. Entries are only ever
 * added to, never reset. Not thread-safe; each call to {@link SlotAssigner} owns its own instance.
 */
final class SlotDebt {

    private final Map<String, Double> debt = new LinkedHashMap<>();

    void register(String teamId) {
        debt.putIfAbsent(teamId, 0.0);
    }

    double of(String teamId) {
        Double d = debt.get(teamId);
        if (d == null) throw new IllegalStateException("Team " + teamId + " was not registered");
        return d;
    }

    void add(String teamId, double delta) {
        debt.put(teamId, of(teamId) + delta);
    }

    Map<String, Double> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(debt));
    }
}

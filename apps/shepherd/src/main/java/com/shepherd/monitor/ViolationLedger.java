package com.shepherd.monitor;

import com.shepherd.api.dto.RegisterOutcome;
import com.shepherd.api.dto.Violation;
import org.springframework.lang.Nullable;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Active violations of one project, at most one per rule id.
 *
 * <p>A violation stays active while {@code firstSeenIndex >= currentIndex - windowSize}; once it
 * falls out of the window it is purged by {@link #expire} and the same rule may alert again.</p>
 */
public final class ViolationLedger {

    private final Map<String, Violation> active = new LinkedHashMap<>();

    public RegisterOutcome register(String ruleId, long messageIndex, @Nullable String suggestion) {
        if (active.containsKey(ruleId)) {
            return RegisterOutcome.DUPLICATE;
        }
        active.put(ruleId, Violation.first(ruleId, messageIndex, suggestion));
        return RegisterOutcome.NEW;
    }

    /** Refreshes recency of an active violation; false when the rule is not active. */
    public boolean touch(String ruleId, long messageIndex) {
        Violation v = active.get(ruleId);
        if (v == null) {
            return false;
        }
        active.put(ruleId, v.seenAt(messageIndex));
        return true;
    }

    /** Purges violations first seen before {@code currentIndex - windowSize}; returns their rule ids. */
    public Set<String> expire(long currentIndex, int windowSize) {
        long threshold = currentIndex - windowSize;
        Set<String> purged = new LinkedHashSet<>();
        Iterator<Map.Entry<String, Violation>> it = active.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Violation> e = it.next();
            if (e.getValue().firstSeenIndex() < threshold) {
                purged.add(e.getKey());
                it.remove();
            }
        }
        return purged;
    }

    public boolean isActive(String ruleId) {
        return active.containsKey(ruleId);
    }

    @Nullable
    public Violation get(String ruleId) {
        return active.get(ruleId);
    }

    /** Active violations in registration order. */
    public List<Violation> active() {
        return List.copyOf(active.values());
    }

    public int size() {
        return active.size();
    }
}

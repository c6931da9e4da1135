package com.mimecast.warden.dedup;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Two-generation set of canonical message identifiers.
 *
 * <p>{@code previous} holds what was handled in the preceding wake-up, {@code current} accumulates
 * <br>what is handled in this one. An identifier in either generation is already handled.
 * <p>Per rule the engine opens a scope seeded with {@code current ∪ previous}, hands it to the pipeline,
 * <br>then closes it keeping only identifiers that are new in this wake-up.
 * <p>Owned by the event loop; not thread-safe.
 */
public class DedupWindow {

    private Set<String> previous = Collections.emptySet();
    private Set<String> current = new LinkedHashSet<>();

    /**
     * Starts a new wake-up: current becomes previous and current is reset.
     */
    public void rotate() {
        previous = Collections.unmodifiableSet(current);
        current = new LinkedHashSet<>();
    }

    /**
     * Opens a rule scope.
     *
     * @return Mutable set holding {@code current ∪ previous}.
     */
    public Set<String> openRuleScope() {
        Set<String> seen = new LinkedHashSet<>(current);
        seen.addAll(previous);
        return seen;
    }

    /**
     * Closes a rule scope, storing {@code seen \ previous} as the current generation.
     *
     * @param seen Set returned by the pipeline.
     */
    public void closeRuleScope(Set<String> seen) {
        Set<String> fresh = new LinkedHashSet<>(seen);
        fresh.removeAll(previous);
        current = fresh;
    }

    /**
     * Checks whether an identifier was already handled in this or the previous wake-up.
     *
     * @param id Canonical identifier.
     * @return Boolean.
     */
    public boolean isHandled(String id) {
        return previous.contains(id) || current.contains(id);
    }

    public Set<String> getPrevious() {
        return Collections.unmodifiableSet(previous);
    }

    public Set<String> getCurrent() {
        return Collections.unmodifiableSet(current);
    }
}

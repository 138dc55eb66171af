package com.jreinhal.oplogstats.oplog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Subscription filter over the oplog.
 *
 * @param position   lower bound on {@code ts}
 * @param inclusive  whether the entry at {@code position} itself is delivered
 * @param namespace  required {@code ns}, or {@code null} for every namespace
 * @param operations accepted operation kinds; empty accepts all
 */
public record OplogFilter(ResumePosition position, boolean inclusive, String namespace, Set<OplogOperation> operations) {

    public OplogFilter {
        Objects.requireNonNull(position, "position");
        operations = operations == null || operations.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(operations));
    }

    /**
     * Entries strictly after {@code position} in {@code namespace} whose kind is one of {@code operations}.
     */
    public static OplogFilter after(ResumePosition position, String namespace, Set<OplogOperation> operations) {
        return new OplogFilter(position, false, namespace, operations);
    }

    /**
     * Every entry from {@code position} onwards, that entry included.
     */
    public static OplogFilter from(ResumePosition position) {
        return new OplogFilter(position, true, null, Collections.emptySet());
    }

    public boolean matches(OplogEntry entry) {
        int cmp = entry.position().compareTo(this.position);
        if (cmp < 0 || (cmp == 0 && !this.inclusive)) {
            return false;
        }
        if (this.namespace != null && !this.namespace.equals(entry.namespace())) {
            return false;
        }
        return this.operations.isEmpty() || this.operations.contains(entry.operation());
    }
}

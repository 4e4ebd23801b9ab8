package com.phillippitts.makeready.service.reconcile;

import com.phillippitts.makeready.domain.ConflictStrategy;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of reconcilers by strategy, with the configured default.
 */
public final class AttributeReconcilers {

    private final Map<ConflictStrategy, AttributeReconciler> byStrategy = new EnumMap<>(ConflictStrategy.class);
    private final ConflictStrategy defaultStrategy;

    public AttributeReconcilers(Collection<? extends AttributeReconciler> reconcilers, ConflictStrategy defaultStrategy) {
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy must not be null");
        for (AttributeReconciler reconciler : reconcilers) {
            byStrategy.put(reconciler.strategy(), reconciler);
        }
        for (ConflictStrategy strategy : ConflictStrategy.values()) {
            if (!byStrategy.containsKey(strategy)) {
                throw new IllegalArgumentException("No reconciler registered for " + strategy);
            }
        }
    }

    /**
     * @param strategy requested strategy, or null for the default
     */
    public AttributeReconciler forStrategy(ConflictStrategy strategy) {
        return byStrategy.get(strategy == null ? defaultStrategy : strategy);
    }

    public ConflictStrategy getDefaultStrategy() {
        return defaultStrategy;
    }
}

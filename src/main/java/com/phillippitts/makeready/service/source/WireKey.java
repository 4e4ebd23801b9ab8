package com.phillippitts.makeready.service.source;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Owner plus the sorted, distinct endpoints of an engineering wire.
 */
record WireKey(String owner, List<String> endpoints) {

    static WireKey of(String owner, Collection<String> endpoints) {
        TreeSet<String> sorted = new TreeSet<>();
        for (String endpoint : endpoints) {
            if (endpoint != null && !endpoint.isEmpty()) {
                sorted.add(endpoint);
            }
        }
        return new WireKey(Objects.toString(owner, ""), List.copyOf(sorted));
    }
}

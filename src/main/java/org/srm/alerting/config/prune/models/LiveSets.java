package org.srm.alerting.config.prune.models;

import org.srm.alerting.config.document.Category;

import java.util.Set;

/**
 * Identifiers reachable from a set of live definitions.
 *
 * @param entryPoints entry points referenced directly by the definitions
 * @param operations  operations reachable from those entry points, through nested operations
 * @param actions     actions referenced by the live entry points or live operations
 */
public record LiveSets(
        Set<String> entryPoints,
        Set<String> operations,
        Set<String> actions
) {
    public Set<String> forCategory(Category category) {
        return switch (category) {
            case ENTRY_POINT -> entryPoints;
            case OPERATION -> operations;
            case ACTION -> actions;
            default -> throw new IllegalArgumentException("No live set for " + category.tag());
        };
    }
}

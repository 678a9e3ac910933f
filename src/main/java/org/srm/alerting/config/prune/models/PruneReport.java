package org.srm.alerting.config.prune.models;

import org.srm.alerting.config.document.Category;

import java.util.List;

/**
 * Outcome of one pruning pass.
 *
 * @param live    what was found reachable before anything was removed
 * @param removed removed nodes, entry points first, then operations, then actions
 */
public record PruneReport(
        LiveSets live,
        List<PrunedNode> removed
) {
    public int removedCount() {
        return removed.size();
    }

    public long removedCount(Category category) {
        return removed.stream().filter(node -> node.category() == category).count();
    }
}

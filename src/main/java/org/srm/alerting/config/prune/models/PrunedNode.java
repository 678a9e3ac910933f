package org.srm.alerting.config.prune.models;

import lombok.Builder;
import org.srm.alerting.config.document.Category;

/**
 * A node removed by the pruner, with the texts an operator needs to recognise it.
 */
@Builder
public record PrunedNode(
        Category category,
        String id,
        String name,
        String className,
        String description
) {
}

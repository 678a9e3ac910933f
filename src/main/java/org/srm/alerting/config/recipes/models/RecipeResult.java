package org.srm.alerting.config.recipes.models;

import java.util.List;

/**
 * What a rewrite recipe did to a document.
 *
 * @param createdIds          ids of the nodes the recipe created, in creation order
 * @param renamedDefinitions  new names of the definitions that were rewritten
 * @param skippedDefinitions  names of selected definitions that were left alone
 * @param rewrittenActions    number of matching actions found across all walks
 */
public record RecipeResult(
        List<String> createdIds,
        List<String> renamedDefinitions,
        List<String> skippedDefinitions,
        int rewrittenActions
) {
}

package org.srm.alerting.config.definitions;

import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.ReachabilityPruner;
import org.srm.alerting.config.prune.models.PruneReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Collection;

/**
 * Drops definitions from a document together with the nodes only they could reach.
 */
public class DefinitionRemover {
    private static final Logger log = LoggerFactory.getLogger(DefinitionRemover.class);

    private final CategoryIndex index;

    public DefinitionRemover(CategoryIndex index) {
        this.index = index;
    }

    /**
     * Removes the unwanted definitions, then prunes everything the wanted ones cannot reach.
     * Nodes shared between a removed and a kept definition stay.
     */
    public PruneReport removeAndPrune(Collection<Element> unwanted, Collection<Element> wanted) {
        for (Element definition : unwanted) {
            NodeHelper.removeWithLeadingWhitespace(definition);
            index.unregister(definition);
        }
        index.rebuild();
        log.info("Removed {} definitions, keeping {}", unwanted.size(), wanted.size());

        return new ReachabilityPruner(index).prune(wanted);
    }
}

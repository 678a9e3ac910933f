package org.srm.alerting.config.prune;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.models.LiveSets;
import org.srm.alerting.config.prune.models.PruneReport;
import org.srm.alerting.config.prune.models.PrunedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes entry points, operations and actions that cannot be reached from a set of live definitions.
 */
public class ReachabilityPruner {
    private static final Logger log = LoggerFactory.getLogger(ReachabilityPruner.class);

    private static final List<Category> PRUNED_CATEGORIES = List.of(Category.ENTRY_POINT, Category.OPERATION, Category.ACTION);

    private final CategoryIndex index;

    public ReachabilityPruner(CategoryIndex index) {
        this.index = index;
    }

    /**
     * Computes what is reachable from the definitions without changing the document.
     */
    public LiveSets liveSets(Collection<Element> liveDefinitions) {
        Set<String> liveEntryPoints = new LinkedHashSet<>();
        for (Element definition : liveDefinitions) {
            liveEntryPoints.addAll(referencedIds(definition, Category.ENTRY_POINT));
        }
        List<Element> entryPointNodes = resolveAll(Category.ENTRY_POINT, liveEntryPoints);

        Set<String> liveOperations = new LinkedHashSet<>();
        Deque<Element> pending = new ArrayDeque<>(entryPointNodes);
        while (!pending.isEmpty()) {
            Element node = pending.pop();
            for (String operationId : referencedIds(node, Category.OPERATION)) {
                if (!liveOperations.add(operationId)) {
                    continue;
                }
                Element operation = index.lookup(Category.OPERATION, operationId);
                if (operation != null) {
                    pending.push(operation);
                }
            }
        }

        Set<String> liveActions = new LinkedHashSet<>();
        for (Element node : entryPointNodes) {
            liveActions.addAll(referencedIds(node, Category.ACTION));
        }
        for (Element node : resolveAll(Category.OPERATION, liveOperations)) {
            liveActions.addAll(referencedIds(node, Category.ACTION));
        }

        return new LiveSets(liveEntryPoints, liveOperations, liveActions);
    }

    /**
     * Removes every indexed entry point, operation and action that is not reachable from the live
     * definitions. Liveness is computed once, before the first removal. References in surviving nodes
     * that pointed at removed nodes are left as they are.
     *
     * @return the live sets and the removed nodes; {@link PruneReport#removedCount()} is the total
     */
    public PruneReport prune(Collection<Element> liveDefinitions) {
        LiveSets live = liveSets(liveDefinitions);

        List<PrunedNode> removed = new ArrayList<>();
        for (Category category : PRUNED_CATEGORIES) {
            Set<String> liveIds = live.forCategory(category);
            int removedHere = 0;
            // Every indexed node, so an earlier duplicate of an unreachable id goes too.
            for (Element node : List.copyOf(index.nodes(category))) {
                String id = CategoryIndex.identifierOf(node);
                if (id != null && liveIds.contains(id)) {
                    continue;
                }
                removed.add(describe(category, id, node));
                NodeHelper.removeWithLeadingWhitespace(node);
                index.unregister(node);
                removedHere++;
            }
            log.debug("{}: {} live, {} removed", category.tag(), liveIds.size(), removedHere);
        }

        index.rebuild();
        log.info("Pruned {} unreachable nodes from {}", removed.size(), index.document().source());
        return new PruneReport(live, removed);
    }

    private Set<String> referencedIds(Element node, Category category) {
        Set<String> ids = new LinkedHashSet<>();
        for (Element reference : NodeHelper.childElementsNamed(node, category.tag())) {
            String target = NodeHelper.referenceTarget(reference);
            if (!target.isEmpty()) {
                ids.add(target);
            }
        }
        return ids;
    }

    private List<Element> resolveAll(Category category, Collection<String> ids) {
        List<Element> nodes = new ArrayList<>();
        for (String id : ids) {
            Element node = index.lookup(category, id);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static PrunedNode describe(Category category, String id, Element node) {
        return PrunedNode.builder()
                .category(category)
                .id(id)
                .name(NodeHelper.firstChildText(node, "name"))
                .className(NodeHelper.firstChildText(node, "class"))
                .description(NodeHelper.firstChildText(node, "description"))
                .build();
    }
}

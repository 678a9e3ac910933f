package org.srm.alerting.config.walk;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.index.CategoryIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Walks the reference graph of a definition: its entry points, then for each node its actions
 * followed by its operations, recursing through operations. Every node is visited at most once
 * per walk, so cyclic references terminate. References that do not resolve are skipped.
 */
public class DefinitionWalker {
    private static final Logger log = LoggerFactory.getLogger(DefinitionWalker.class);

    private final CategoryIndex index;

    public DefinitionWalker(CategoryIndex index) {
        this.index = index;
    }

    /**
     * Walks the definition, calling the visitor once per reachable node.
     *
     * @param definition a {@code definition-list} node
     * @param visitor    callback; a non-null return value stops the walk
     * @return the first non-null visitor result, or null if the visitor never returned one
     */
    public <R> R walk(Element definition, NodeVisitor<R> visitor) {
        if (NodeHelper.categoryOf(definition) != Category.DEFINITION) {
            throw new IllegalArgumentException("Expected a " + Category.DEFINITION.tag()
                    + " node but got <" + NodeHelper.localName(definition) + ">");
        }

        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        for (Element entryPoint : resolveReferences(definition, Category.ENTRY_POINT)) {
            if (!seen.add(entryPoint)) {
                continue;
            }
            R result = visitor.visit(entryPoint, definition);
            if (result == null) {
                result = descend(entryPoint, visitor, seen);
            }
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    private <R> R descend(Element node, NodeVisitor<R> visitor, Set<Element> seen) {
        for (Element action : resolveReferences(node, Category.ACTION)) {
            if (seen.add(action)) {
                R result = visitor.visit(action, node);
                if (result != null) {
                    return result;
                }
            }
        }

        for (Element operation : resolveReferences(node, Category.OPERATION)) {
            if (!seen.add(operation)) {
                continue;
            }
            R result = visitor.visit(operation, node);
            if (result == null) {
                result = descend(operation, visitor, seen);
            }
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Resolves the reference children of one category, in document order. The list is a snapshot,
     * so a visitor may append links to {@code node} while it is being walked.
     */
    private List<Element> resolveReferences(Element node, Category category) {
        List<Element> targets = new ArrayList<>();
        for (Element reference : NodeHelper.childElementsNamed(node, category.tag())) {
            Element target = index.resolve(reference);
            if (target == null) {
                log.debug("Dangling {} reference '{}' in <{} {}>", category.tag(), NodeHelper.referenceTarget(reference),
                        NodeHelper.localName(node), CategoryIndex.identifierOf(node));
                continue;
            }
            targets.add(target);
        }
        return targets;
    }

    /**
     * All nodes reachable from the definition, in visit order.
     */
    public List<Element> collect(Element definition) {
        List<Element> visited = new ArrayList<>();
        walk(definition, (node, parent) -> {
            visited.add(node);
            return null;
        });
        return visited;
    }

    /**
     * First reachable node matching the predicate, or null.
     */
    public Element find(Element definition, Predicate<Element> predicate) {
        return walk(definition, NodeVisitor.ofNode(node -> predicate.test(node) ? node : null));
    }
}

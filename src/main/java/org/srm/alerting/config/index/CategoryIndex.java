package org.srm.alerting.config.index;

import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index over the top-level nodes of an alerting document.
 * <p>
 * Holds, per category, the nodes in document order, the node a new node of that category must be
 * inserted before, and an identifier index resolving {@code (category, id)} to its node. Only direct
 * children of the root are indexed.
 * <p>
 * The index is a derived view: it does not follow changes to the document by itself.
 * Call {@link #rebuild()} after adding or removing top-level nodes.
 */
public class CategoryIndex {
    private static final Logger log = LoggerFactory.getLogger(CategoryIndex.class);

    private final AlertingDocument document;
    private final Map<Category, List<Element>> listByCategory = new LinkedHashMap<>();
    private final Map<Category, Element> refPointByCategory = new EnumMap<>(Category.class);
    private final Map<Category, Map<String, Element>> idsByCategory = new EnumMap<>(Category.class);
    private final List<String> unknownTags = new ArrayList<>();

    private CategoryIndex(AlertingDocument document) {
        this.document = document;
    }

    public static CategoryIndex build(AlertingDocument document) {
        CategoryIndex index = new CategoryIndex(document);
        index.rebuild();
        return index;
    }

    public void rebuild() {
        listByCategory.clear();
        refPointByCategory.clear();
        idsByCategory.clear();
        unknownTags.clear();

        for (Element child : NodeHelper.childElements(document.root())) {
            Category category = NodeHelper.categoryOf(child);
            if (category == null) {
                log.warn("Skipping unknown top-level element <{}> in {}", NodeHelper.localName(child), document.source());
                unknownTags.add(NodeHelper.localName(child));
                continue;
            }

            listByCategory.computeIfAbsent(category, c -> new ArrayList<>()).add(child);

            String id = identifierOf(child);
            if (id == null) {
                continue;
            }
            Element previous = idsByCategory.computeIfAbsent(category, c -> new LinkedHashMap<>()).put(id, child);
            if (previous != null) {
                log.warn("Duplicate {} id '{}' in {}; the later node is indexed", category.tag(), id, document.source());
            }
        }

        computeRefPoints();

        if (!isCategoryOrderValid()) {
            log.warn("Category order is broken in {} for {}", document.source(), outOfOrderCategories());
        }
    }

    private void computeRefPoints() {
        Category[] order = Category.values();
        Element next = null;
        for (int i = order.length - 1; i >= 0; i--) {
            refPointByCategory.put(order[i], next);
            List<Element> nodes = listByCategory.get(order[i]);
            if (nodes != null && !nodes.isEmpty()) {
                next = nodes.get(0);
            }
        }

        for (Map.Entry<Category, Element> entry : refPointByCategory.entrySet()) {
            Element refPoint = entry.getValue();
            if (refPoint != null && refPoint.getParentNode() != document.root()) {
                throw new StructuralInvariantViolationException("Insertion point for " + entry.getKey().tag()
                        + " is <" + NodeHelper.localName(refPoint) + "> which is not a direct child of the root");
            }
        }
    }

    /**
     * Declared identifier of a node: its {@code id} attribute, else its {@code name} attribute.
     *
     * @return the identifier, or null if neither attribute is set
     */
    public static String identifierOf(Element node) {
        String id = node.getAttribute("id");
        if (!id.isEmpty()) {
            return id;
        }
        String name = node.getAttribute("name");
        return name.isEmpty() ? null : name;
    }

    public Element lookup(Category category, String id) {
        if (category == null || id == null || id.isEmpty()) {
            return null;
        }
        Map<String, Element> ids = idsByCategory.get(category);
        return ids != null ? ids.get(id) : null;
    }

    /**
     * Resolves a reference element (e.g. {@code <operation-list>O1</operation-list>}) to the node it names.
     *
     * @return the target node, or null for a dangling reference or an element that is not a reference
     */
    public Element resolve(Element reference) {
        Category category = NodeHelper.categoryOf(reference);
        if (category == null || !category.isReference()) {
            return null;
        }
        return lookup(category, NodeHelper.referenceTarget(reference));
    }

    public boolean contains(Category category, String id) {
        return lookup(category, id) != null;
    }

    public List<Element> nodes(Category category) {
        List<Element> nodes = listByCategory.get(category);
        return nodes == null ? List.of() : Collections.unmodifiableList(nodes);
    }

    public Set<String> identifiers(Category category) {
        Map<String, Element> ids = idsByCategory.get(category);
        return ids == null ? new LinkedHashSet<>() : new LinkedHashSet<>(ids.keySet());
    }

    /**
     * Node a new node of the category is inserted before; null means append at the end of the root.
     */
    public Element refPoint(Category category) {
        return refPointByCategory.get(category);
    }

    /**
     * Categories present in the document, in order of first appearance, with their nodes in document order.
     */
    public Map<Category, List<Element>> listByCategory() {
        return Collections.unmodifiableMap(listByCategory);
    }

    public List<String> unknownTags() {
        return Collections.unmodifiableList(unknownTags);
    }

    /**
     * Drops a node from the lists and the identifier index without touching the document.
     * Insertion points are only refreshed by {@link #rebuild()}.
     */
    public void unregister(Element node) {
        Category category = NodeHelper.categoryOf(node);
        if (category == null) {
            return;
        }
        List<Element> nodes = listByCategory.get(category);
        if (nodes != null) {
            nodes.remove(node);
            if (nodes.isEmpty()) {
                listByCategory.remove(category);
            }
        }
        String id = identifierOf(node);
        Map<String, Element> ids = idsByCategory.get(category);
        if (id != null && ids != null && ids.get(id) == node) {
            ids.remove(id);
        }
    }

    public boolean isCategoryOrderValid() {
        return outOfOrderCategories().isEmpty();
    }

    /**
     * Categories whose first occurrence comes after the first occurrence of a category that must follow them.
     */
    public List<Category> outOfOrderCategories() {
        List<Category> outOfOrder = new ArrayList<>();
        int highest = -1;
        // keys are in order of first appearance
        for (Category category : listByCategory.keySet()) {
            if (category.ordinal() < highest) {
                outOfOrder.add(category);
            } else {
                highest = category.ordinal();
            }
        }
        return outOfOrder;
    }

    public AlertingDocument document() {
        return document;
    }
}

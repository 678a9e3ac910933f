package org.srm.alerting.config.factory;

import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.factory.models.NodeComponent;
import org.srm.alerting.config.index.CategoryIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Creates top-level nodes at the position the category order requires, and links nodes together
 * with reference elements.
 */
public class NodeFactory {
    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    private final CategoryIndex index;

    public NodeFactory(CategoryIndex index) {
        this.index = index;
    }

    /**
     * Creates a node and inserts it before the insertion point of its category.
     * The index is rebuilt afterwards, so the new node can be looked up and linked to immediately.
     *
     * @param category   category of the new node
     * @param identifier value of the new node's {@code id} attribute
     * @param components sub-elements to append, in order
     * @return the inserted node
     * @throws DuplicateIdentifierException if the category already has a node with this id;
     *                                      the document is left untouched
     */
    public Element createNode(Category category, String identifier, List<NodeComponent> components) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("A new " + category.tag() + " node needs an id");
        }
        if (index.contains(category, identifier)) {
            throw new DuplicateIdentifierException(category, identifier);
        }

        AlertingDocument document = index.document();
        Document doc = document.dom();

        Element node = NodeHelper.createElement(document, category.tag());
        node.setAttribute("id", identifier);
        node.appendChild(doc.createTextNode("\n    "));
        for (NodeComponent component : components) {
            Element element = NodeHelper.createTextElement(document, component.tag(), component.text());
            if (component.name() != null) {
                element.setAttribute("name", component.name());
            }
            NodeHelper.appendIndented(node, element);
        }

        NodeHelper.insertTopLevel(document.root(), node, index.refPoint(category));
        index.rebuild();

        log.debug("Created {} '{}'", category.tag(), identifier);
        return node;
    }

    /**
     * Appends to {@code source} a reference to {@code dest}, e.g.
     * {@code <action-list from="true" to="entry">Ac3</action-list>}.
     * Adding the same link twice yields two reference elements.
     *
     * @param fromPort branch of the source the link leaves from, e.g. "output" or "true"
     * @param toPort   branch of the destination the link enters, usually "entry"
     */
    public Element addLink(Element source, Element dest, String fromPort, String toPort) {
        Category category = NodeHelper.categoryOf(dest);
        if (category == null || !category.isReference()) {
            throw new IllegalArgumentException("Cannot link to <" + NodeHelper.localName(dest)
                    + ">, only to entry points, operations and actions");
        }
        String destId = CategoryIndex.identifierOf(dest);
        if (destId == null) {
            throw new IllegalArgumentException("Cannot link to a " + category.tag() + " node without an id");
        }

        Element link = NodeHelper.createTextElement(index.document(), category.tag(), destId);
        link.setAttribute("from", fromPort);
        link.setAttribute("to", toPort);
        NodeHelper.appendIndented(source, link);

        log.debug("Linked {} -> {} ({} -> {})", CategoryIndex.identifierOf(source), destId, fromPort, toPort);
        return link;
    }
}

package org.srm.alerting.config.walk;

import org.w3c.dom.Element;

import java.util.function.Function;

/**
 * Callback for {@link DefinitionWalker}. Returning a non-null value stops the walk and makes it the
 * walk's result; returning null continues.
 *
 * @param <R> result type
 */
@FunctionalInterface
public interface NodeVisitor<R> {

    /**
     * @param node   the resolved entry point, operation or action
     * @param parent the definition or node whose reference led to {@code node}
     */
    R visit(Element node, Element parent);

    /**
     * Adapts a visitor that does not care about the parent.
     */
    static <R> NodeVisitor<R> ofNode(Function<Element, R> visitor) {
        return (node, parent) -> visitor.apply(node);
    }
}

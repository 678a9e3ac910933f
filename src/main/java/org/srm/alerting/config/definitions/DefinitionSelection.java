package org.srm.alerting.config.definitions;

import org.w3c.dom.Element;

import java.util.List;

/**
 * Definitions split by a selection predicate, both lists in document order.
 */
public record DefinitionSelection(
        List<Element> wanted,
        List<Element> unwanted
) {
    public int total() {
        return wanted.size() + unwanted.size();
    }
}

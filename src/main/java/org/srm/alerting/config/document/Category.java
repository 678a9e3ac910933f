package org.srm.alerting.config.document;

import java.util.EnumSet;
import java.util.Set;

/**
 * Top-level node categories of an alerting configuration, declared in the order
 * the alerting backend requires their first occurrences to appear.
 */
public enum Category {
    ADAPTER("adapter-list"),
    DEFINITION("definition-list"),
    ENTRY_POINT("entry-point-list"),
    OPERATION("operation-list"),
    ACTION("action-list"),
    GROUPED_BOX("grouped-box-list"),
    COMPONENT_TEMPLATE("component-template-list");

    /**
     * Categories whose elements also appear as short reference children inside other nodes.
     */
    public static final Set<Category> REFERENCE_CATEGORIES = EnumSet.of(ENTRY_POINT, OPERATION, ACTION);

    private final String tag;

    Category(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isReference() {
        return REFERENCE_CATEGORIES.contains(this);
    }

    /**
     * Maps an element tag to its category.
     *
     * @param tag the element's local name, e.g. "operation-list"
     * @return the category, or null if the tag is not a known top-level category
     */
    public static Category fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        for (Category category : values()) {
            if (category.tag.equals(tag)) {
                return category;
            }
        }
        return null;
    }
}

package org.srm.alerting.config.factory;

import org.srm.alerting.config.document.Category;

public class DuplicateIdentifierException extends IllegalStateException {
    private final Category category;
    private final String identifier;

    public DuplicateIdentifierException(Category category, String identifier) {
        super("A " + category.tag() + " node with id '" + identifier + "' already exists");
        this.category = category;
        this.identifier = identifier;
    }

    public Category getCategory() {
        return category;
    }

    public String getIdentifier() {
        return identifier;
    }
}

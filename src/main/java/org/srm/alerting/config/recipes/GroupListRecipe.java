package org.srm.alerting.config.recipes;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.factory.models.NodeComponent;
import org.srm.alerting.config.index.CategoryIndex;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Routes every matching trap action's parent into a group-list operation as well, so mail and trap
 * delivery are decided by the grouped box behind it.
 */
public class GroupListRecipe extends TrapActionRecipe {
    static final String DESCRIPTION = "Always send an email, also send a trap if the severity is high enough.";

    private final String operationClass;

    public GroupListRecipe(CategoryIndex index, String oldActionClass, String operationClass, String suffix) {
        super(index, oldActionClass, suffix);
        this.operationClass = operationClass;
    }

    @Override
    protected void rewrite(Element parent, Element action, String definitionName) {
        Element groupList = createOrReuse(Category.OPERATION, CategoryIndex.identifierOf(action) + "-grouplist", List.of(
                NodeComponent.of("name", actionText(action, "name", "action")),
                NodeComponent.of("class", operationClass),
                NodeComponent.of("description", DESCRIPTION)));
        if (!isLinked(parent, groupList)) {
            factory.addLink(parent, groupList, "output", "entry");
        }
    }
}

package org.srm.alerting.config.recipes;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.factory.models.NodeComponent;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.recipes.models.EmailRecipeOptions;
import org.w3c.dom.Element;

import java.util.List;

/**
 * Puts a counter operation with two mail actions next to every matching trap action.
 * <p>
 * For an action {@code A} reached from {@code P} this adds
 * {@code P -(output)-> A-counter}, {@code A-counter -(false)-> A-email-2} and
 * {@code A-counter -(true)-> A-email-1}. The original trap action stays linked.
 */
public class EmailActionRecipe extends TrapActionRecipe {
    private final EmailRecipeOptions options;

    public EmailActionRecipe(CategoryIndex index, EmailRecipeOptions options) {
        super(index, options.oldActionClass(), options.suffix());
        this.options = options;
    }

    @Override
    protected boolean shouldSkip(Element definition) {
        return options.skipDefinitionsWithMail()
                && MailActionDetector.sendsMail(walker, definition, options.mailActionClass());
    }

    @Override
    protected void rewrite(Element parent, Element action, String definitionName) {
        String actionId = CategoryIndex.identifierOf(action);

        Element counterNode = createOrReuse(Category.OPERATION, actionId + "-counter", List.of(
                NodeComponent.of("name", actionText(action, "name", "counter")),
                NodeComponent.of("class", options.counterOperationClass()),
                NodeComponent.of("description", actionText(action, "description", "counter")),
                NodeComponent.param("time-range", options.timeRange()),
                NodeComponent.param("counter", options.counter()),
                NodeComponent.param("time-based", options.timeBased())));
        if (!isLinked(parent, counterNode)) {
            factory.addLink(parent, counterNode, "output", "entry");
        }

        String message = options.message() + "\n" + definitionName;

        Element onFalse = createOrReuse(Category.ACTION, actionId + "-email-2",
                mailComponents(action, options.subject(), message));
        if (!isLinked(counterNode, onFalse)) {
            factory.addLink(counterNode, onFalse, "false", "entry");
        }

        Element onTrue = createOrReuse(Category.ACTION, actionId + "-email-1",
                mailComponents(action, options.subject() + ".", message));
        if (!isLinked(counterNode, onTrue)) {
            factory.addLink(counterNode, onTrue, "true", "entry");
        }
    }

    private List<NodeComponent> mailComponents(Element action, String subject, String message) {
        return List.of(
                NodeComponent.of("name", actionText(action, "name", "email")),
                NodeComponent.of("class", options.mailActionClass()),
                NodeComponent.of("description", actionText(action, "description", "email")),
                NodeComponent.param("to", options.to()),
                NodeComponent.param("subject", subject),
                NodeComponent.param("message", message));
    }
}

package org.srm.alerting.config.recipes;

import org.srm.alerting.config.definitions.DefinitionHelper;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.factory.NodeFactory;
import org.srm.alerting.config.factory.models.NodeComponent;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.recipes.models.RecipeResult;
import org.srm.alerting.config.walk.DefinitionWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Base for recipes that rename each selected definition and then rewrite, in place, every action of a
 * given class reachable from it. Subclasses decide what to build around such an action.
 */
public abstract class TrapActionRecipe {
    private static final Logger log = LoggerFactory.getLogger(TrapActionRecipe.class);

    protected final CategoryIndex index;
    protected final DefinitionWalker walker;
    protected final NodeFactory factory;

    private final String oldActionClass;
    private final String suffix;

    private final List<String> createdIds = new ArrayList<>();
    private int rewrittenActions;

    protected TrapActionRecipe(CategoryIndex index, String oldActionClass, String suffix) {
        this.index = index;
        this.walker = new DefinitionWalker(index);
        this.factory = new NodeFactory(index);
        this.oldActionClass = oldActionClass;
        this.suffix = suffix;
    }

    public RecipeResult apply(Collection<Element> definitions) {
        List<String> renamed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        createdIds.clear();
        rewrittenActions = 0;

        // Decided up front: rewriting one definition can add mail actions behind a shared operation.
        List<Element> toRewrite = new ArrayList<>();
        for (Element definition : definitions) {
            if (shouldSkip(definition)) {
                skipped.add(DefinitionHelper.nameOf(definition));
            } else {
                toRewrite.add(definition);
            }
        }

        for (Element definition : toRewrite) {
            String newName = DefinitionHelper.rename(definition, suffix);
            renamed.add(newName);

            walker.walk(definition, (node, parent) -> {
                if (hasClass(node, Category.ACTION, oldActionClass)) {
                    log.debug("Rewriting action '{}' reached from '{}'", CategoryIndex.identifierOf(node),
                            CategoryIndex.identifierOf(parent));
                    rewrittenActions++;
                    rewrite(parent, node, newName);
                }
                return null;
            });
        }

        log.info("Rewrote {} actions in {} definitions, created {} nodes", rewrittenActions, renamed.size(), createdIds.size());
        return new RecipeResult(List.copyOf(createdIds), renamed, skipped, rewrittenActions);
    }

    /**
     * Builds the replacement structure for one matching action.
     *
     * @param parent         node whose reference led to the action
     * @param action         the matching action
     * @param definitionName renamed definition being walked
     */
    protected abstract void rewrite(Element parent, Element action, String definitionName);

    protected boolean shouldSkip(Element definition) {
        return false;
    }

    /**
     * Creates a node, or returns the existing one when an earlier walk already created it
     * (an action shared by several parents or definitions).
     */
    protected Element createOrReuse(Category category, String id, List<NodeComponent> components) {
        Element existing = index.lookup(category, id);
        if (existing != null) {
            log.debug("Reusing existing {} '{}'", category.tag(), id);
            return existing;
        }
        Element created = factory.createNode(category, id, components);
        createdIds.add(id);
        return created;
    }

    /**
     * Whether {@code source} already holds a reference to {@code dest}, on any port.
     */
    protected static boolean isLinked(Element source, Element dest) {
        String destId = CategoryIndex.identifierOf(dest);
        for (Element reference : NodeHelper.childElementsNamed(source, NodeHelper.localName(dest))) {
            if (NodeHelper.referenceTarget(reference).equals(destId)) {
                return true;
            }
        }
        return false;
    }

    protected static String actionText(Element action, String tag, String replacement) {
        return NodeHelper.firstChildText(action, tag).replace("trap", replacement);
    }

    public static boolean hasClass(Element node, Category category, String className) {
        return NodeHelper.categoryOf(node) == category
                && className.equals(NodeHelper.firstChildText(node, "class").trim());
    }
}

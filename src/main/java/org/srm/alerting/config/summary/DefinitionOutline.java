package org.srm.alerting.config.summary;

import org.srm.alerting.config.definitions.DefinitionHelper;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.document.NodeHelper;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.walk.DefinitionWalker;
import org.w3c.dom.Element;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Indented outline of what each definition reaches. A node reachable along several paths is listed
 * once, under the parent it was first reached from.
 */
public class DefinitionOutline {
    private static final String INDENT = "  ";

    public static String render(CategoryIndex index) {
        DefinitionWalker walker = new DefinitionWalker(index);
        StringBuilder out = new StringBuilder();

        for (Element definition : index.nodes(Category.DEFINITION)) {
            out.append("definition: ").append(DefinitionHelper.nameOf(definition));
            if (!DefinitionHelper.isEnabled(definition)) {
                out.append(" [disabled]");
            }
            out.append('\n');

            Map<Element, Integer> depths = new IdentityHashMap<>();
            depths.put(definition, 0);
            walker.walk(definition, (node, parent) -> {
                int depth = depths.getOrDefault(parent, 0) + 1;
                depths.put(node, depth);
                out.append(INDENT.repeat(depth)).append(label(node)).append(": ")
                        .append(CategoryIndex.identifierOf(node));
                String name = NodeHelper.firstChildText(node, "name").trim();
                if (!name.isEmpty()) {
                    out.append(" (").append(name).append(')');
                }
                out.append('\n');
                return null;
            });
        }
        return out.toString();
    }

    private static String label(Element node) {
        Category category = NodeHelper.categoryOf(node);
        if (category == Category.ENTRY_POINT) {
            return "entry point";
        }
        return category == Category.OPERATION ? "operation" : "action";
    }
}

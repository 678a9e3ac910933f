package org.srm.alerting.config.summary;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.index.CategoryIndex;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Count of top-level nodes per category, as a plain text table.
 */
public class CategorySummary {
    private static final String ROW = "%-23s %5s%n";

    public static String render(CategoryIndex index) {
        StringBuilder out = new StringBuilder();
        out.append(String.format(ROW, "TAG", "COUNT"));
        for (Category category : Category.values()) {
            out.append(String.format(ROW, category.tag(), index.nodes(category).size()));
        }
        if (!index.unknownTags().isEmpty()) {
            out.append(String.format(ROW, "(unknown)", index.unknownTags().size()));
        }
        out.append('\n');

        List<Category> outOfOrder = index.outOfOrderCategories();
        if (outOfOrder.isEmpty()) {
            out.append("category order: ok\n");
        } else {
            out.append("category order: broken, first ")
                    .append(outOfOrder.stream().map(Category::tag).collect(Collectors.joining(", ")))
                    .append(" appear too late\n");
        }
        return out.toString();
    }
}

package org.srm.alerting.config.definitions;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.index.CategoryIndex;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Predicates for choosing which definitions a run keeps or rewrites.
 */
public class DefinitionSelector {

    public static Predicate<Element> all() {
        return definition -> true;
    }

    public static Predicate<Element> enabled() {
        return DefinitionHelper::isEnabled;
    }

    public static Predicate<Element> named(Collection<String> names) {
        Set<String> wantedNames = Set.copyOf(names);
        return definition -> wantedNames.contains(DefinitionHelper.nameOf(definition));
    }

    public static Predicate<Element> nameEndsWith(String suffix) {
        return definition -> DefinitionHelper.nameOf(definition).endsWith(suffix);
    }

    public static DefinitionSelection partition(CategoryIndex index, Predicate<Element> wanted) {
        List<Element> selected = new ArrayList<>();
        List<Element> rest = new ArrayList<>();
        for (Element definition : index.nodes(Category.DEFINITION)) {
            (wanted.test(definition) ? selected : rest).add(definition);
        }
        return new DefinitionSelection(selected, rest);
    }
}

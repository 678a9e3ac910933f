package org.srm.alerting.config.definitions;

import java.util.Map;
import java.util.TreeMap;

/**
 * Folds slash-separated definition names ("Health/Disk/Full") into a sorted tree for display.
 */
public class DefinitionNameTree {
    private final Map<String, DefinitionNameTree> children = new TreeMap<>();

    public void add(String definitionName) {
        DefinitionNameTree branch = this;
        for (String part : definitionName.split("/")) {
            branch = branch.children.computeIfAbsent(part, p -> new DefinitionNameTree());
        }
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public String render(String indent) {
        StringBuilder out = new StringBuilder();
        render(indent, 0, out);
        return out.toString();
    }

    private void render(String indent, int depth, StringBuilder out) {
        for (Map.Entry<String, DefinitionNameTree> entry : children.entrySet()) {
            out.append(indent.repeat(depth)).append(entry.getKey()).append('\n');
            entry.getValue().render(indent, depth + 1, out);
        }
    }
}

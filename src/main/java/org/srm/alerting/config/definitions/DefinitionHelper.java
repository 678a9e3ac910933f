package org.srm.alerting.config.definitions;

import org.w3c.dom.Element;

public class DefinitionHelper {

    public static String nameOf(Element definition) {
        return definition.getAttribute("name");
    }

    public static boolean isEnabled(Element definition) {
        return "true".equals(definition.getAttribute("enabled"));
    }

    public static void setEnabled(Element definition, boolean enabled) {
        definition.setAttribute("enabled", Boolean.toString(enabled));
    }

    /**
     * Appends a suffix to the definition's name so a rewritten copy does not clash with the original.
     *
     * @return the new name
     */
    public static String rename(Element definition, String suffix) {
        if (suffix == null || suffix.isBlank()) {
            return nameOf(definition);
        }
        String newName = nameOf(definition) + " " + suffix;
        definition.setAttribute("name", newName);
        return newName;
    }
}

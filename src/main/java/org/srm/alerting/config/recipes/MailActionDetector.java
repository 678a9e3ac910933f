package org.srm.alerting.config.recipes;

import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.walk.DefinitionWalker;
import org.w3c.dom.Element;

public class MailActionDetector {

    /**
     * @return the first action of the given class reachable from the definition, or null
     */
    public static Element findMailAction(DefinitionWalker walker, Element definition, String mailActionClass) {
        return walker.find(definition, node -> TrapActionRecipe.hasClass(node, Category.ACTION, mailActionClass));
    }

    public static boolean sendsMail(DefinitionWalker walker, Element definition, String mailActionClass) {
        return findMailAction(walker, definition, mailActionClass) != null;
    }
}

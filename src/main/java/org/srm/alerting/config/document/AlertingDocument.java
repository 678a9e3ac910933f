package org.srm.alerting.config.document;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * A loaded alerting configuration.
 *
 * @param dom    the parsed DOM document, mutated in place during a run
 * @param root   the {@code AlertingConfig} root element
 * @param source where the document was read from (file path or a label), used in messages
 */
public record AlertingDocument(
        Document dom,
        Element root,
        String source
) {
    public static final String ROOT_TAG = "AlertingConfig";

    /**
     * Namespace of the root element; new elements are created in it so they inherit the default xmlns.
     */
    public String namespace() {
        return root.getNamespaceURI();
    }
}

package org.srm.alerting.config.factory.models;

/**
 * One sub-element of a node created by the node factory,
 * e.g. {@code <param-list name="to">ops@example.com</param-list>}.
 *
 * @param tag  the sub-element tag, e.g. "class" or "param-list"
 * @param name value of the sub-element's {@code name} attribute, or null to omit it
 * @param text the sub-element's text content
 */
public record NodeComponent(
        String tag,
        String name,
        String text
) {
    public static NodeComponent of(String tag, String text) {
        return new NodeComponent(tag, null, text);
    }

    public static NodeComponent param(String name, String text) {
        return new NodeComponent("param-list", name, text);
    }
}

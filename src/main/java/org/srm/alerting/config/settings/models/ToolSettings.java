package org.srm.alerting.config.settings.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of the tool's settings file.
 * Example: {"suffix": "(with email)", "classes": {...}, "email": {...}, "counter": {...}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolSettings {
    /**
     * Appended to the names of rewritten definitions. "{date}" is replaced with the ISO date of the run.
     * Example: "(with email)"
     */
    public String suffix;

    public ClassNames classes;
    public EmailSettings email;
    public CounterSettings counter;
}

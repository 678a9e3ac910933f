package org.srm.alerting.config.settings.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class EmailSettings {
    /**
     * Comma separated recipients.
     */
    public String to;
    public String subject;
    public String message;
}

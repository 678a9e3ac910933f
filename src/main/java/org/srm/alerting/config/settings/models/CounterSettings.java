package org.srm.alerting.config.settings.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parameters of the counter operation placed in front of generated mail actions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CounterSettings {
    /**
     * Time window of the collected values, in minutes.
     */
    public String timeRange;

    public String counter;

    /**
     * "true" to emit a result for each value, "false" to emit only on state changes.
     */
    public String timeBased;
}

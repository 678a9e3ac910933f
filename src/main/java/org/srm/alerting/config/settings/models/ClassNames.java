package org.srm.alerting.config.settings.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Values of the {@code <class>} element the rewrite recipes look for and generate.
 * They are matched and copied as plain text.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassNames {
    /**
     * Class of the actions to duplicate.
     */
    public String oldAction;

    /**
     * Class of the mail actions created by the email recipe; also what marks a definition as already mailing.
     */
    public String newAction;

    /**
     * Class of the counter operations created by the email recipe.
     */
    public String newOperation;

    /**
     * Class, or grouped-box id, of the operations created by the group-list recipe.
     */
    public String groupListOperation;
}

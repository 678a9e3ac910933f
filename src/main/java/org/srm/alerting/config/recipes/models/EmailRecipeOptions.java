package org.srm.alerting.config.recipes.models;

import lombok.Builder;
import org.srm.alerting.config.settings.models.ToolSettings;

/**
 * Inputs of the email recipe: which actions to match, what to generate, and the generated parameters.
 */
@Builder(toBuilder = true)
public record EmailRecipeOptions(
        String oldActionClass,
        String mailActionClass,
        String counterOperationClass,

        String to,
        String subject,
        String message,

        String timeRange,
        String counter,
        String timeBased,

        String suffix,
        boolean skipDefinitionsWithMail
) {
    public static EmailRecipeOptionsBuilder fromSettings(ToolSettings settings) {
        return EmailRecipeOptions.builder()
                .oldActionClass(settings.classes.oldAction)
                .mailActionClass(settings.classes.newAction)
                .counterOperationClass(settings.classes.newOperation)
                .to(settings.email.to)
                .subject(settings.email.subject)
                .message(settings.email.message)
                .timeRange(settings.counter.timeRange)
                .counter(settings.counter.counter)
                .timeBased(settings.counter.timeBased)
                .suffix(settings.suffix);
    }
}

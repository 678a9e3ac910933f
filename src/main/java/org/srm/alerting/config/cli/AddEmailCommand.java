package org.srm.alerting.config.cli;

import org.srm.alerting.config.definitions.DefinitionHelper;
import org.srm.alerting.config.definitions.DefinitionNameTree;
import org.srm.alerting.config.definitions.DefinitionSelection;
import org.srm.alerting.config.definitions.DefinitionSelector;
import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.recipes.EmailActionRecipe;
import org.srm.alerting.config.recipes.models.EmailRecipeOptions;
import org.srm.alerting.config.recipes.models.RecipeResult;
import org.srm.alerting.config.settings.ToolSettingsHelper;
import org.srm.alerting.config.settings.models.ToolSettings;
import org.w3c.dom.Element;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Command(
        name = "add-email",
        mixinStandardHelpOptions = true,
        description = "Add a counter and two email actions next to every SNMP trap action of the selected definitions"
)
public class AddEmailCommand extends DocumentCommand {

    @Spec
    private CommandSpec spec;

    @Option(names = {"--definition", "-d"}, paramLabel = "<name>",
            description = "Definition to rewrite, repeatable (default: every enabled definition)")
    private List<String> definitions = new ArrayList<>();

    @Option(names = "--suffix", paramLabel = "<text>",
            description = "Suffix added to rewritten definition names, to not conflict with existing names")
    private String suffix;

    @Option(names = "--skip-with-mail", description = "Leave definitions that already send mail alone")
    private boolean skipWithMail;

    @Option(names = "--to", paramLabel = "<recipients>", description = "Comma separated list of recipients")
    private String to;

    @Option(names = "--subject", paramLabel = "<text>", description = "Subject of the email")
    private String subject;

    @Option(names = "--message", paramLabel = "<body>",
            description = "Body of the email; VALUE, TMST, UNIX_TMST, ID and PROP.'name' are expanded by the alerting backend")
    private String message;

    @Option(names = "--time-range", paramLabel = "<minutes>", description = "Time window of the counter")
    private String timeRange;

    @Option(names = "--counter", paramLabel = "<n>", description = "Count the counter waits for")
    private String counter;

    @Option(names = "--time-based",
            description = "Emit the counter result for every value instead of only on state changes")
    private boolean timeBased;

    @Option(names = "--old-action", paramLabel = "<class>", description = "Class of the actions to duplicate")
    private String oldAction;

    @Option(names = "--new-operation", paramLabel = "<class>", description = "Class of the counter operation to add")
    private String newOperation;

    @Option(names = "--new-action", paramLabel = "<class>", description = "Class of the email actions to add")
    private String newAction;

    @Option(names = "--disable-rewritten",
            description = "Write the rewritten definitions disabled, to be enabled once imported")
    private boolean disableRewritten;

    @Override
    public Integer call() {
        ToolSettings settings = loadSettings();
        EmailRecipeOptions options = resolveOptions(settings);
        if (options.to() == null || options.to().isBlank()) {
            throw new ParameterException(spec.commandLine(), "--to is required (or email.to in the settings)");
        }

        AlertingDocument document = loadDocument();
        CategoryIndex index = CategoryIndex.build(document);

        DefinitionSelection selection = DefinitionSelector.partition(index,
                definitions.isEmpty() ? DefinitionSelector.enabled() : DefinitionSelector.named(definitions));
        System.out.println("rewriting " + selection.wanted().size() + " of " + selection.total() + " definitions");
        if (selection.wanted().isEmpty()) {
            return 0;
        }

        RecipeResult result = new EmailActionRecipe(index, options).apply(selection.wanted());
        System.out.println("found " + result.rewrittenActions() + " trap actions, created " + result.createdIds().size() + " nodes");
        result.skippedDefinitions().forEach(name -> System.out.println("skipped (already sends mail): " + name));
        if (disableRewritten) {
            for (Element definition : selection.wanted()) {
                if (!result.skippedDefinitions().contains(DefinitionHelper.nameOf(definition))) {
                    DefinitionHelper.setEnabled(definition, false);
                }
            }
        }

        write(document, outputPath("-email"));

        DefinitionNameTree tree = new DefinitionNameTree();
        result.renamedDefinitions().forEach(tree::add);
        System.out.print(tree.render("\t"));
        return 0;
    }

    EmailRecipeOptions resolveOptions(ToolSettings settings) {
        EmailRecipeOptions.EmailRecipeOptionsBuilder builder = EmailRecipeOptions.fromSettings(settings)
                .skipDefinitionsWithMail(skipWithMail)
                .suffix(ToolSettingsHelper.resolveSuffix(suffix != null ? suffix : settings.suffix, LocalDate.now()));
        if (to != null) builder.to(to);
        if (subject != null) builder.subject(subject);
        if (message != null) builder.message(message);
        if (timeRange != null) builder.timeRange(timeRange);
        if (counter != null) builder.counter(counter);
        if (timeBased) builder.timeBased("true");
        if (oldAction != null) builder.oldActionClass(oldAction);
        if (newOperation != null) builder.counterOperationClass(newOperation);
        if (newAction != null) builder.mailActionClass(newAction);
        return builder.build();
    }
}

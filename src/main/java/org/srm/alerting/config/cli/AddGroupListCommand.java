package org.srm.alerting.config.cli;

import org.srm.alerting.config.definitions.DefinitionNameTree;
import org.srm.alerting.config.definitions.DefinitionRemover;
import org.srm.alerting.config.definitions.DefinitionSelection;
import org.srm.alerting.config.definitions.DefinitionSelector;
import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.models.PruneReport;
import org.srm.alerting.config.recipes.GroupListRecipe;
import org.srm.alerting.config.recipes.models.RecipeResult;
import org.srm.alerting.config.settings.ToolSettingsHelper;
import org.srm.alerting.config.settings.models.ToolSettings;
import org.srm.alerting.config.summary.CategorySummary;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.LocalDate;
import java.util.List;

@Command(
        name = "add-grouplist",
        mixinStandardHelpOptions = true,
        description = "Route every SNMP trap action's parent through a group-list operation"
)
public class AddGroupListCommand extends DocumentCommand {
    static final String PREVIOUS_RUN_SUFFIX = "email)";

    @Option(names = "--suffix", paramLabel = "<text>", defaultValue = "({date})",
            description = "Suffix added to definition names; {date} is today's date (default: ${DEFAULT-VALUE})")
    private String suffix;

    @Option(names = "--old-action", paramLabel = "<class>", description = "Class of the actions to locate")
    private String oldAction;

    @Option(names = "--operation", paramLabel = "<class>", description = "Class or grouped-box id of the operation to add")
    private String operation;

    @Override
    public Integer call() {
        ToolSettings settings = loadSettings();
        AlertingDocument document = loadDocument();
        CategoryIndex index = CategoryIndex.build(document);

        System.out.print(CategorySummary.render(index));
        System.out.println();

        DefinitionSelection selection = DefinitionSelector.partition(index,
                DefinitionSelector.nameEndsWith(PREVIOUS_RUN_SUFFIX).negate());
        PruneReport pruned = new DefinitionRemover(index).removeAndPrune(selection.unwanted(), selection.wanted());
        System.out.println("keeping " + selection.wanted().size() + " of " + selection.total() + " definitions");
        System.out.println("removed " + (selection.unwanted().size() + pruned.removedCount()) + " nodes");

        GroupListRecipe recipe = new GroupListRecipe(index,
                oldAction != null ? oldAction : settings.classes.oldAction,
                operation != null ? operation : settings.classes.groupListOperation,
                ToolSettingsHelper.resolveSuffix(suffix, LocalDate.now()));
        RecipeResult result = recipe.apply(List.copyOf(index.nodes(Category.DEFINITION)));
        System.out.println("found " + result.rewrittenActions() + " trap actions, created " + result.createdIds().size() + " nodes");

        write(document, outputPath("-new"));

        DefinitionNameTree tree = new DefinitionNameTree();
        result.renamedDefinitions().forEach(tree::add);
        System.out.print(tree.render("\t"));
        return 0;
    }
}

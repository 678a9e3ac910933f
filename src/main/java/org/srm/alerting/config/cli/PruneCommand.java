package org.srm.alerting.config.cli;

import org.srm.alerting.config.definitions.DefinitionSelector;
import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.Category;
import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.prune.ReachabilityPruner;
import org.srm.alerting.config.prune.models.PruneReport;
import org.srm.alerting.config.prune.models.PrunedNode;
import org.w3c.dom.Element;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

@Command(
        name = "prune",
        mixinStandardHelpOptions = true,
        description = "Remove entry points, operations and actions no definition can reach"
)
public class PruneCommand extends DocumentCommand {
    private static final String ROW = "%-23s %5s %7s%n";

    @Option(names = "--enabled-only", description = "Treat only enabled definitions as live")
    private boolean enabledOnly;

    @Option(names = {"--verbose", "-v"}, description = "List every removed node")
    private boolean verbose;

    @Override
    public Integer call() {
        AlertingDocument document = loadDocument();
        CategoryIndex index = CategoryIndex.build(document);

        List<Element> live = DefinitionSelector.partition(index,
                enabledOnly ? DefinitionSelector.enabled() : DefinitionSelector.all()).wanted();
        System.out.println("keeping " + live.size() + " of " + index.nodes(Category.DEFINITION).size() + " definitions");

        PruneReport report = new ReachabilityPruner(index).prune(live);

        System.out.printf(ROW, "TAG", "LIVE", "REMOVED");
        for (Category category : List.of(Category.ENTRY_POINT, Category.OPERATION, Category.ACTION)) {
            System.out.printf(ROW, category.tag(), report.live().forCategory(category).size(), report.removedCount(category));
        }
        if (verbose) {
            for (PrunedNode node : report.removed()) {
                System.out.println();
                System.out.println("'id': '" + node.id() + "',");
                System.out.println("'name': '" + node.name() + "',");
                System.out.println("'class': '" + node.className() + "',");
                System.out.println("'description': '" + node.description() + "',");
            }
            System.out.println("---");
        }
        System.out.println("removed " + report.removedCount() + " nodes");

        write(document, outputPath("-new"));
        return 0;
    }
}

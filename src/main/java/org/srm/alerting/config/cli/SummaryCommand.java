package org.srm.alerting.config.cli;

import org.srm.alerting.config.index.CategoryIndex;
import org.srm.alerting.config.summary.CategorySummary;
import org.srm.alerting.config.summary.DefinitionOutline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "summary",
        mixinStandardHelpOptions = true,
        description = "Print node counts per category and check the category order; nothing is written"
)
public class SummaryCommand extends DocumentCommand {

    @Option(names = "--outline", description = "Also print what every definition reaches")
    private boolean outline;

    @Override
    public Integer call() {
        CategoryIndex index = CategoryIndex.build(loadDocument());
        System.out.print(CategorySummary.render(index));
        if (outline) {
            System.out.println();
            System.out.print(DefinitionOutline.render(index));
        }
        return 0;
    }
}

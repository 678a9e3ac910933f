package org.srm.alerting.config.cli;

import org.srm.alerting.config.document.AlertingDocument;
import org.srm.alerting.config.document.AlertingDocumentHelper;
import org.srm.alerting.config.settings.ToolSettingsHelper;
import org.srm.alerting.config.settings.models.ToolSettings;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Options shared by every command that reads an alerting document.
 */
abstract class DocumentCommand implements Callable<Integer> {

    @Parameters(
            paramLabel = "<file>",
            arity = "0..1",
            defaultValue = "alerting.xml",
            description = "Alerting definition file, e.g. $APG_HOME/Backends/Alerting-Backend/Default/conf/alerting.xml (default: ${DEFAULT-VALUE})"
    )
    protected Path input;

    @Option(names = {"--output", "-o"}, paramLabel = "<file>",
            description = "Where to write the result (default: the input name with a marker before the extension)")
    protected Path output;

    @Option(names = "--settings", paramLabel = "<file>",
            description = "Settings JSON overriding the bundled defaults")
    protected Path settingsFile;

    protected AlertingDocument loadDocument() {
        return AlertingDocumentHelper.parse(input);
    }

    protected ToolSettings loadSettings() {
        return settingsFile != null ? ToolSettingsHelper.load(settingsFile) : ToolSettingsHelper.loadDefault();
    }

    /**
     * @param marker inserted before the input's extension when no output was given, e.g. "-new"
     */
    protected Path outputPath(String marker) {
        if (output != null) {
            return output;
        }
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String outputName = dot > 0
                ? fileName.substring(0, dot) + marker + fileName.substring(dot)
                : fileName + marker;
        return input.resolveSibling(outputName);
    }

    protected void write(AlertingDocument document, Path outputPath) {
        AlertingDocumentHelper.write(document, outputPath);
        System.out.println("writing " + outputPath);
    }
}

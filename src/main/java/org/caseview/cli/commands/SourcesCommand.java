package org.caseview.cli.commands;

import org.caseview.cli.CommandLineInterface;
import org.caseview.reader.CaseReaderOptions;
import org.caseview.reader.SqliteCaseReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "sources",
    description = "List the recording sources of a case store"
)
public class SourcesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Case store file")
    private Path file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try (SqliteCaseReader reader = SqliteCaseReader.open(file, CaseReaderOptions.fromConfig(parent.getConfig()))) {
            for (String source : reader.listSources()) {
                spec.commandLine().getOut().println(source);
            }
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error listing sources: " + e.getMessage());
            return 1;
        }
    }
}

package org.caseview.cli.commands;

import org.caseview.api.SourceNotFoundException;
import org.caseview.cli.CommandLineInterface;
import org.caseview.model.CaseTree;
import org.caseview.reader.CaseReaderOptions;
import org.caseview.reader.SqliteCaseReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "cases",
    description = "List the case coordinates of a source"
)
public class CasesCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Case store file")
    private Path file;

    @Option(
        names = {"-s", "--source"},
        description = "Source: driver, problem, a system or solver source, or a coordinate (default: root)"
    )
    private String source = "";

    @Option(
        names = {"-r", "--recurse"},
        description = "Include all descendants"
    )
    private boolean recurse;

    @Option(
        names = {"-t", "--tree"},
        description = "Print the cases as an indented tree"
    )
    private boolean tree;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (SqliteCaseReader reader = SqliteCaseReader.open(file, CaseReaderOptions.fromConfig(parent.getConfig()))) {
            if (tree) {
                printTree(out, reader.listCaseTree(source, recurse), 0);
            } else {
                reader.listCases(source, recurse).forEach(out::println);
            }
            return 0;
        } catch (SourceNotFoundException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error listing cases: " + e.getMessage());
            return 1;
        }
    }

    private void printTree(PrintWriter out, Map<String, CaseTree<String>> nodes, int depth) {
        for (Map.Entry<String, CaseTree<String>> node : nodes.entrySet()) {
            out.println("  ".repeat(depth) + node.getKey());
            printTree(out, node.getValue().children(), depth + 1);
        }
    }
}

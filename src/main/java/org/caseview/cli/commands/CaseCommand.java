package org.caseview.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.caseview.api.CaseNotFoundException;
import org.caseview.cli.CommandLineInterface;
import org.caseview.codec.JsonArrays;
import org.caseview.model.Case;
import org.caseview.model.CaseValues;
import org.caseview.model.DerivativeKey;
import org.caseview.model.ShapedArray;
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
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "case",
    description = "Show one recorded case"
)
public class CaseCommand implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Parameters(index = "0", description = "Case store file")
    private Path file;

    @Parameters(index = "1", description = "Iteration coordinate or problem case name")
    private String id;

    @Option(
        names = {"-j", "--json"},
        description = "Print the case as JSON"
    )
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try (SqliteCaseReader reader = SqliteCaseReader.open(file, CaseReaderOptions.fromConfig(parent.getConfig()))) {
            Case found = reader.getCase(id, false);
            if (json) {
                out.println(toJson(found));
            } else {
                printSummary(out, found);
            }
            return 0;
        } catch (CaseNotFoundException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error reading case: " + e.getMessage());
            return 1;
        }
    }

    static String toJson(Case value) throws JsonProcessingException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("category", value.category().label());
        root.put("iterationCoordinate", value.iterationCoordinate());
        root.put("source", value.source());
        root.put("counter", value.counter());
        root.put("timestamp", value.timestamp());
        root.put("success", value.success());
        root.put("message", value.message());
        putValues(root, "inputs", value.inputs());
        putValues(root, "outputs", value.outputs());
        putValues(root, "residuals", value.residuals());
        if (value.absoluteError() != null) {
            root.put("absoluteError", value.absoluteError());
        }
        if (value.relativeError() != null) {
            root.put("relativeError", value.relativeError());
        }
        if (value.jacobian() != null) {
            ObjectNode jacobian = root.putObject("jacobian");
            for (Map.Entry<DerivativeKey, ShapedArray> block : value.jacobian().asMap().entrySet()) {
                jacobian.set(block.getKey().toString(), JsonArrays.toJson(block.getValue()));
            }
        }
        return MAPPER.writeValueAsString(root);
    }

    private static void putValues(ObjectNode root, String field, CaseValues values) {
        if (values == null) {
            return;
        }
        ObjectNode node = root.putObject(field);
        values.asMap().forEach((name, array) -> node.set(name, JsonArrays.toJson(array)));
    }

    private void printSummary(PrintWriter out, Case value) {
        out.println("=== " + value.category().label() + " case " + value.iterationCoordinate() + " ===");
        out.println("Source: " + value.source());
        out.println("Counter: " + value.counter());
        out.println("Timestamp: " + Instant.ofEpochMilli(Math.round(value.timestamp() * 1000)));
        out.println("Success: " + value.success() + (value.message() == null || value.message().isEmpty()
            ? "" : " (" + value.message() + ")"));
        if (value.absoluteError() != null) {
            out.printf("Errors: abs=%g rel=%g%n", value.absoluteError(),
                value.relativeError() == null ? Double.NaN : value.relativeError());
        }
        printValues(out, "Outputs", value.outputs());
        printValues(out, "Inputs", value.inputs());
        printValues(out, "Residuals", value.residuals());
        if (value.jacobian() != null) {
            out.println("Derivatives:");
            value.jacobian().asMap().forEach((key, array) -> out.println("  " + key + " = " + array));
        }
    }

    private void printValues(PrintWriter out, String title, CaseValues values) {
        if (values == null) {
            return;
        }
        out.println(title + ":");
        values.asMap().forEach((name, array) -> out.println("  " + name + " = " + array));
    }
}

package org.caseview.cli;

import org.caseview.testutil.CaseStoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("integration")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private Path store;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        store = CaseStoreFixture.optimizationRun(4, 2).writeTo(tempDir.resolve("cases.sql"));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private static String lines(String... lines) {
        return String.join(System.lineSeparator(), lines) + System.lineSeparator();
    }

    @Test
    void sources_shouldPrintOneSourcePerLine() {
        final int exitCode = run("sources", store.toString());

        assertEquals(0, exitCode);
        assertEquals(lines("driver", "problem", "root", "root.nonlinear_solver"), out.toString());
    }

    @Test
    void cases_withSourceAndRecurse_shouldListInExecutionOrder() {
        final int exitCode = run("cases", store.toString(), "--source", "rank0:SLSQP|1", "--recurse");

        assertEquals(0, exitCode);
        assertEquals(lines(
            "rank0:SLSQP|1|root._solve_nonlinear|1|NLRunOnce|0",
            "rank0:SLSQP|1|root._solve_nonlinear|1",
            "rank0:SLSQP|1"), out.toString());
    }

    @Test
    void cases_tree_shouldIndentChildren() {
        final int exitCode = run("cases", store.toString(), "-r", "-t");

        assertEquals(0, exitCode);
        assertThat(out.toString()).startsWith(lines(
            "rank0:SLSQP|0",
            "  rank0:SLSQP|0|root._solve_nonlinear|0",
            "    rank0:SLSQP|0|root._solve_nonlinear|0|NLRunOnce|0"));
    }

    @Test
    void cases_unknownSource_shouldExitWithTwo() {
        final int exitCode = run("cases", store.toString(), "-s", "nowhere");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Source not found: nowhere");
    }

    @Test
    void case_json_shouldPrintValues() {
        final int exitCode = run("case", store.toString(), "rank0:SLSQP|1", "--json");

        assertEquals(0, exitCode);
        assertThat(out.toString())
            .contains("\"category\" : \"driver\"")
            .contains("\"pz.z\" : [ 4.75, 2.5 ]")
            .contains("\"obj,z\"");
    }

    @Test
    void case_summary_shouldNameTheCase() {
        final int exitCode = run("case", store.toString(), "final");

        assertEquals(0, exitCode);
        assertThat(out.toString()).contains("=== problem case final ===").contains("Outputs:");
    }

    @Test
    void case_unknownId_shouldExitWithTwo() {
        final int exitCode = run("case", store.toString(), "rank0:SLSQP|77");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("rank0:SLSQP|77");
    }

    @Test
    void sources_invalidStore_shouldExitWithOne() throws Exception {
        final Path text = Files.writeString(tempDir.resolve("notes.txt"), "plain text");

        assertEquals(1, run("sources", text.toString()));
        assertThat(err.toString()).contains("Error listing sources");
    }

    @Test
    void getConfig_missingFile_shouldThrow() {
        final CommandLineInterface cli = new CommandLineInterface();
        new CommandLine(cli).parseArgs("--config", tempDir.resolve("absent.conf").toString());

        assertThatThrownBy(cli::getConfig)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Configuration file not found");
    }

    @Test
    void getConfig_file_shouldLayerOverDefaults() throws Exception {
        final Path conf = Files.writeString(tempDir.resolve("app.conf"), "caseview.reader.busy-timeout-ms = 42");
        final CommandLineInterface cli = new CommandLineInterface();
        new CommandLine(cli).parseArgs("-c", conf.toString());

        assertEquals(42, cli.getConfig().getInt("caseview.reader.busy-timeout-ms"));
        assertEquals(false, cli.getConfig().getBoolean("caseview.reader.pre-load"));
    }
}

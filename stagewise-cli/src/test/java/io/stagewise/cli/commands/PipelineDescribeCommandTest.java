package io.stagewise.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

@DisplayName("describe command")
class PipelineDescribeCommandTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = StagewiseCli.commandLine();
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
    }

    @Test
    @DisplayName("prints the resolved order as text by default")
    void shouldDescribeAsText() {
        cli.execute("describe");

        assertThat(out.toString())
                .contains("Pipeline: IncomingContext")
                .containsSubsequence(
                        "Stage 1: IncomingContext",
                        "1. LogMessage",
                        "2. Audit",
                        "3. CheckCancellation",
                        "-> ToOutgoing",
                        "Stage 2: OutgoingContext",
                        "-> Dispatch");
    }

    @Test
    @DisplayName("prints a Mermaid diagram on request")
    void shouldDescribeAsMermaid() {
        cli.execute("describe", "--format", "mermaid");

        assertThat(out.toString())
                .contains("```mermaid")
                .contains("flowchart LR")
                .contains("CheckCancellation --> ToOutgoing");
    }

    @Test
    @DisplayName("prints a JSON document on request")
    void shouldDescribeAsJson() {
        cli.execute("describe", "--format", "json");

        assertThat(out.toString())
                .contains("\"rootShape\" : \"IncomingContext\"")
                .contains("\"leadsTo\" : \"OutgoingContext\"");
    }

    @Test
    @DisplayName("reflects disabled steps")
    void shouldOmitDisabledSteps() {
        cli.execute("describe", "--disable", "LogMessage", "--disable", "audit");

        assertThat(out.toString())
                .contains("1. CheckCancellation")
                .doesNotContain("LogMessage [")
                .doesNotContain("Audit [");
    }

    @Test
    @DisplayName("rejects an unknown format")
    void shouldRejectUnknownFormat() {
        cli.execute("describe", "--format", "svg");

        assertThat(err.toString())
                .contains("[FAIL] Describe failed")
                .contains("Unsupported format: svg");
    }
}

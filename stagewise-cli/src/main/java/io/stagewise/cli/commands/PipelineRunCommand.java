package io.stagewise.cli.commands;

import io.stagewise.cli.demo.DemoPipeline;
import io.stagewise.cli.demo.IncomingContext;
import io.stagewise.core.cancellation.CancellationSource;
import io.stagewise.core.exception.BehaviorConstructionException;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.execution.CompiledPipeline;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import picocli.CommandLine;

/// Builds the demo pipeline once and executes it once per requested signal.
///
/// With the default signal list the output follows the classic demo: a plain run,
/// two runs with cancellation requested up front, then another plain run. A
/// cancelled run prints the steps that ran before the cancellation check,
/// followed by `Canceled`.
@CommandLine.Command(name = "run", description = "Build and execute the demo pipeline")
class PipelineRunCommand extends PipelineCommand {

    enum SignalMode {
        NONE,
        CANCELLED
    }

    @CommandLine.Option(
            names = "--signals",
            split = ",",
            paramLabel = "MODE",
            defaultValue = "none,cancelled,cancelled,none",
            description = "Comma-separated signal per execution: none, cancelled")
    List<SignalMode> signals = new ArrayList<>();

    @Override
    protected void execute() {
        PrintWriter out = out();
        try (CompiledPipeline<IncomingContext> pipeline =
                createFactory().build(DemoPipeline.INCOMING)) {
            int execution = 1;
            for (SignalMode mode : signals) {
                if (execution > 1) {
                    out.println();
                }
                runOnce(pipeline, execution++, mode, out);
            }
        } catch (PipelineConfigurationException | BehaviorConstructionException e) {
            err().println(" [FAIL] Pipeline build failed: " + e.getMessage());
        }
    }

    private static void runOnce(
            CompiledPipeline<IncomingContext> pipeline, int execution, SignalMode mode, PrintWriter out) {
        CancellationSource source = new CancellationSource();
        if (mode == SignalMode.CANCELLED) {
            source.cancel();
            out.println("Execute " + execution + " with Cancellation");
        } else {
            out.println("Execute " + execution);
        }

        IncomingContext context = new IncomingContext("message " + execution);
        try {
            pipeline.execute(context, source.signal()).toCompletableFuture().join();
            printTrace(context, out);
        } catch (CancellationException e) {
            printTrace(context, out);
            out.println("Canceled");
        }
    }

    private static void printTrace(IncomingContext context, PrintWriter out) {
        for (String line : context.trace()) {
            out.println("  " + line);
        }
    }
}

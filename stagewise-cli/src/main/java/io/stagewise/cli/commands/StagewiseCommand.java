package io.stagewise.cli.commands;

import java.io.PrintWriter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/// Minimal abstract base for all Stagewise CLI commands.
///
/// Owns the banner display and the {@link #run()} / {@link #execute()} contract.
/// Output goes through the writers of the owning {@link picocli.CommandLine}, so
/// callers can redirect it.
///
/// @see PipelineCommand
public abstract class StagewiseCommand implements Runnable {

    private static final String[] BANNER = {
        "",
        "  stagewise",
        "  =========",
        "  Staged Behavior Pipelines",
        ""
    };

    @Spec CommandSpec spec;

    @Override
    public final void run() {
        PrintWriter out = out();
        for (String line : BANNER) {
            out.println(line);
        }
        execute();
        out.flush();
        err().flush();
    }

    protected abstract void execute();

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }
}

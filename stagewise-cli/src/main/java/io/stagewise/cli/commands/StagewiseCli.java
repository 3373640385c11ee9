package io.stagewise.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Main entry point for the Stagewise CLI.
///
/// Registers the subcommands working on the demo pipeline:
/// - `run` - Build the pipeline and execute it once per requested signal
/// - `describe` - Print the resolved order as text or Mermaid diagram
///
/// @see PipelineRunCommand
/// @see PipelineDescribeCommand
@Command(
        name = "stagewise",
        description = "Staged behavior pipelines",
        mixinStandardHelpOptions = true,
        subcommands = {PipelineRunCommand.class, PipelineDescribeCommand.class})
public class StagewiseCli {

    private static final Logger logger = Logger.getLogger(StagewiseCli.class.getName());

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /// Creates the configured command line. Enum option values are matched
    /// ignoring case.
    ///
    /// @return new command line, never null
    public static CommandLine commandLine() {
        return new CommandLine(new StagewiseCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    static void configureLogging() {
        try (InputStream in = StagewiseCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }
}

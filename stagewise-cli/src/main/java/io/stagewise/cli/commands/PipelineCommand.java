package io.stagewise.cli.commands;

import io.stagewise.cli.demo.DemoPipeline;
import io.stagewise.core.PipelineFactory;
import io.stagewise.core.settings.SettingsHolder;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import picocli.CommandLine.Option;

/// Base class for commands working on the demo pipeline.
///
/// Every `--disable` value becomes a settings override read by the demo steps'
/// enablement predicates before the settings are locked.
///
/// @see PipelineRunCommand
/// @see PipelineDescribeCommand
public abstract class PipelineCommand extends StagewiseCommand {

    private static final Logger logger = Logger.getLogger(PipelineCommand.class.getName());

    @Option(
            names = "--disable",
            paramLabel = "ID",
            description = "Step id to leave out of the pipeline (repeatable)")
    protected List<String> disabledSteps = new ArrayList<>();

    /// Creates a factory holding the demo registrations and the settings derived
    /// from the command line.
    ///
    /// @return configured factory, never null
    protected PipelineFactory.Builder createFactory() {
        SettingsHolder settings = new SettingsHolder();
        for (String stepId : disabledSteps) {
            settings.set(DemoPipeline.disabledKey(stepId), Boolean.TRUE);
            logger.fine("Disabled step '" + stepId + "' from the command line");
        }
        return DemoPipeline.register(PipelineFactory.builder().settings(settings));
    }
}

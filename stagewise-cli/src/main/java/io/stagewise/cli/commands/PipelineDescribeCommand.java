package io.stagewise.cli.commands;

import io.stagewise.cli.demo.DemoPipeline;
import io.stagewise.cli.visualizer.PipelineVisualizer;
import io.stagewise.core.exception.PipelineConfigurationException;
import io.stagewise.core.model.PipelineModel;
import picocli.CommandLine;

@CommandLine.Command(
        name = "describe",
        description = "Print the resolved stage and step order without building behaviors")
class PipelineDescribeCommand extends PipelineCommand {

    @CommandLine.Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid, json")
    String format;

    PipelineVisualizer visualizer = PipelineVisualizer.withDefaultFormats();

    @Override
    protected void execute() {
        try {
            PipelineModel model = createFactory().buildModel(DemoPipeline.INCOMING);
            out().println(visualizer.visualize(model, format));
        } catch (PipelineConfigurationException | IllegalArgumentException e) {
            err().println(" [FAIL] Describe failed: " + e.getMessage());
        }
    }
}

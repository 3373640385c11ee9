package io.stagewise.cli.visualizer;

import io.stagewise.core.model.PipelineModel;

/// Strategy interface for rendering a resolved pipeline in one output format.
///
/// ### Built-in Formats
/// - `text` - numbered steps grouped by stage ({@link TextPipelineFormat})
/// - `mermaid` - Mermaid flowchart syntax ({@link MermaidPipelineFormat})
/// - `json` - stages and steps as a JSON document ({@link JsonPipelineFormat})
///
/// @see PipelineVisualizer
public interface PipelineFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection (e.g., "text", "mermaid"), never null
    String getName();

    /// Renders the resolved pipeline in this format.
    ///
    /// @param model the resolved pipeline, not null
    /// @return formatted string representation, never null
    String render(PipelineModel model);
}

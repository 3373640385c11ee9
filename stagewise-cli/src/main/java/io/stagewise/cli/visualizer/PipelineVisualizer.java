package io.stagewise.cli.visualizer;

import io.stagewise.core.model.PipelineModel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Registry and dispatcher for pipeline rendering formats.
///
/// @implNote Thread-safe after construction. The format map is never modified.
/// @see PipelineFormat
public class PipelineVisualizer {

    private final Map<String, PipelineFormat> formats = new LinkedHashMap<>();

    /// Creates a visualizer over the given formats.
    ///
    /// @param formats available formats, not null; a later format replaces an
    ///     earlier one with the same name
    public PipelineVisualizer(List<? extends PipelineFormat> formats) {
        Objects.requireNonNull(formats, "formats must not be null");
        for (PipelineFormat format : formats) {
            this.formats.put(format.getName(), format);
        }
    }

    /// Creates a visualizer with the text, Mermaid and JSON formats.
    ///
    /// @return new visualizer, never null
    public static PipelineVisualizer withDefaultFormats() {
        return new PipelineVisualizer(
                List.of(
                        new TextPipelineFormat(), new MermaidPipelineFormat(), new JsonPipelineFormat()));
    }

    /// Renders the model using the named format.
    ///
    /// @param model the resolved pipeline, not null
    /// @param formatName the format name (e.g., "text", "mermaid"), not null
    /// @return formatted visualization, never null
    /// @throws IllegalArgumentException if the format is not registered
    public String visualize(PipelineModel model, String formatName) {
        PipelineFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(model);
    }

    /// Renders the model using the `text` format.
    ///
    /// @param model the resolved pipeline, not null
    /// @return text visualization, never null
    public String visualize(PipelineModel model) {
        return visualize(model, "text");
    }

    /// Returns the names of all registered formats.
    ///
    /// @return format names in registration order, never null
    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}

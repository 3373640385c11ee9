package io.stagewise.cli.demo;

import io.stagewise.core.behavior.BehaviorContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Base of the demo contexts: collects one line per behavior that ran, so a
/// run can be printed after it completes or is cancelled.
public abstract class DemoContext implements BehaviorContext {

    private final List<String> trace;

    protected DemoContext(List<String> trace) {
        this.trace = trace;
    }

    protected DemoContext() {
        this(Collections.synchronizedList(new ArrayList<>()));
    }

    public void record(String line) {
        trace.add(line);
    }

    public List<String> trace() {
        return List.copyOf(trace);
    }

    List<String> sharedTrace() {
        return trace;
    }
}

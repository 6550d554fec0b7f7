package com.syntex.natiq.converter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.syntex.natiq.error.ConversionException;

/**
 * Per-file outcome of a conversion run, in the order the files were handled.
 */
public class ConversionReport {

    private final List<Outcome> outcomes = new ArrayList<>();
    private boolean aborted;

    public void addSuccess(String name, Path output) {
        outcomes.add(new Outcome(name, output, null));
    }

    public void addFailure(String name, ConversionException error) {
        outcomes.add(new Outcome(name, null, error));
    }

    void abort() {
        aborted = true;
    }

    /** True when a fatal error stopped the run before every task was tried. */
    public boolean isAborted() {
        return aborted;
    }

    public List<Outcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<Outcome> succeeded() {
        return outcomes.stream().filter(Outcome::ok).toList();
    }

    public List<Outcome> failed() {
        return outcomes.stream().filter(o -> !o.ok()).toList();
    }

    public boolean hasFailures() {
        return aborted || !failed().isEmpty();
    }

    public String summary() {
        return succeeded().size() + " converted, " + failed().size() + " failed" + (aborted ? " (aborted)" : "");
    }

    public record Outcome(String name, Path output, ConversionException error) {
        public boolean ok() {
            return error == null;
        }
    }
}

package ircube.convert.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-file results of one batch run, in processing order.
 */
public final class BatchReport {

    private final Path directory;
    private final List<ConversionResult> results;

    public BatchReport(Path directory, List<ConversionResult> results) {
        this.directory = directory;
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public Path getDirectory() {
        return directory;
    }

    public List<ConversionResult> getResults() {
        return results;
    }

    public List<ConversionResult> getSuccesses() {
        return results.stream().filter(ConversionResult::isSuccess).toList();
    }

    public List<ConversionResult> getFailures() {
        return results.stream().filter(r -> !r.isSuccess()).toList();
    }

    public int getSuccessCount() {
        return getSuccesses().size();
    }

    public int getFailureCount() {
        return getFailures().size();
    }

    public boolean hasFailures() {
        return getFailureCount() > 0;
    }

    @Override
    public String toString() {
        return String.format("BatchReport[%s: %d converted, %d failed]",
                directory, getSuccessCount(), getFailureCount());
    }
}

package ircube.convert.model;

import java.nio.file.Path;

/**
 * Outcome of converting one file in a batch.
 *
 * @param source the input file
 * @param output the written CSV, null on failure
 * @param cause why the conversion failed, null on success
 */
public record ConversionResult(Path source, Path output, Throwable cause) {

    public ConversionResult {
        if (source == null) {
            throw new IllegalArgumentException("Source path must not be null");
        }
        if ((output == null) == (cause == null)) {
            throw new IllegalArgumentException("Exactly one of output and cause must be set");
        }
    }

    public static ConversionResult success(Path source, Path output) {
        return new ConversionResult(source, output, null);
    }

    public static ConversionResult failure(Path source, Throwable cause) {
        return new ConversionResult(source, null, cause);
    }

    public boolean isSuccess() {
        return cause == null;
    }

    /** Failure message suitable for a report line, or null on success. */
    public String failureMessage() {
        if (cause == null) {
            return null;
        }
        String msg = cause.getMessage();
        return cause.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ConversionResult[OK " + source + " -> " + output + "]"
                : "ConversionResult[FAILED " + source + ": " + failureMessage() + "]";
    }
}

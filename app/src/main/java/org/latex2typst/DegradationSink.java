package org.latex2typst;

import java.util.Optional;

/**
 * Receives a note every time the converter takes a lossy fallback path.
 *
 * Reporting and repair live outside the converter, it only calls this.
 */
@FunctionalInterface
public interface DegradationSink {
    DegradationSink IGNORE = (kind, name, message, snippet) -> {};

    void record(DegradationKind kind, String name, String message, Optional<String> snippet);

    default void record(DegradationKind kind, String name, String message) {
        record(kind, name, message, Optional.empty());
    }
}

package org.latex2typst;

import java.util.Optional;

// Something in the input that couldn't be converted with full fidelity
public record Degradation(
    String id,
    DegradationKind kind,
    String name,
    String message,
    Optional<String> snippet
) {}

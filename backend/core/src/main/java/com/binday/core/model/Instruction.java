package com.binday.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One guidance paragraph harvested for a stream, with the absolute links it contains in document order.
 */
public record Instruction(String text, List<String> links) {
    public Instruction {
        Objects.requireNonNull(text, "text is required");
        links = links == null ? List.of() : List.copyOf(links);
    }
}

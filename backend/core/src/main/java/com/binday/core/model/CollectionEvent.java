package com.binday.core.model;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

public record CollectionEvent(
        ZonedDateTime date,
        WasteType type,
        List<Instruction> instructions,
        String note
) {
    public CollectionEvent {
        Objects.requireNonNull(date, "date is required");
        Objects.requireNonNull(type, "type is required");
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        note = note == null ? "" : note;
    }

    /**
     * Deduplication key: ISO offset date-time plus stream name.
     */
    public String key() {
        return date.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME) + "|" + type.label();
    }

    public CollectionEvent withNote(String updatedNote) {
        return new CollectionEvent(date, type, instructions, updatedNote);
    }

    public CollectionEvent withInstructions(List<Instruction> updatedInstructions) {
        return new CollectionEvent(date, type, updatedInstructions, note);
    }
}

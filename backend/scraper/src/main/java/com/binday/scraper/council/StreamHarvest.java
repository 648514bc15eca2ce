package com.binday.scraper.council;

import com.binday.core.model.Instruction;
import com.binday.scraper.config.StreamRule;

import java.util.List;

/**
 * Everything extracted for one stream whose container exists on the page.
 *
 * @param notice text of the "upcoming dates" region, captured for the garden stream only
 */
public record StreamHarvest(StreamRule rule, List<Instruction> instructions, String notice, List<RawEntry> entries) {
    public StreamHarvest {
        instructions = List.copyOf(instructions);
        notice = notice == null ? "" : notice;
        entries = List.copyOf(entries);
    }
}

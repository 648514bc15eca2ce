package com.binday.scraper.council;

import com.binday.core.model.Instruction;
import com.binday.core.model.WasteType;
import com.binday.core.util.HtmlUtils;
import com.binday.scraper.api.ScheduleParseException;
import com.binday.scraper.config.StreamRule;
import com.binday.scraper.config.StreamRules;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Pulls raw (day, month) entries, guidance paragraphs and notices out of the schedule page, one
 * {@link StreamRule} at a time. A stream whose container is missing is skipped; that is normal for
 * seasonal services.
 */
public final class StreamExtractor {
    private static final Logger LOGGER = Logger.getLogger(StreamExtractor.class.getName());

    private final String baseUrl;
    private final List<StreamRule> rules;

    public StreamExtractor(String baseUrl, List<StreamRule> rules) {
        this.baseUrl = baseUrl;
        this.rules = List.copyOf(rules);
    }

    public List<StreamHarvest> extract(byte[] body) {
        Document document;
        try {
            document = Jsoup.parse(new ByteArrayInputStream(body), null, baseUrl);
        } catch (IOException e) {
            throw new ScheduleParseException("schedule document could not be parsed", e);
        }
        return extract(document);
    }

    public List<StreamHarvest> extract(Document document) {
        Element schedule = document.selectFirst(StreamRules.SCHEDULE_CONTAINER);
        if (schedule == null) {
            LOGGER.warning("Schedule container " + StreamRules.SCHEDULE_CONTAINER + " not found");
            return List.of();
        }

        List<StreamHarvest> harvests = new ArrayList<>();
        for (StreamRule rule : rules) {
            Elements block = schedule.select(rule.containerSelector());
            if (block.isEmpty()) {
                LOGGER.fine("No container for " + rule.type().label() + ", skipping stream");
                continue;
            }
            List<Instruction> instructions = extractInstructions(block);
            String notice = rule.type() == WasteType.GARDEN_WASTE ? extractNotice(block) : "";

            List<RawEntry> entries = new ArrayList<>();
            for (Element entry : block.select(rule.entrySelector())) {
                String day = text(entry.selectFirst(rule.daySelector()));
                String month = text(entry.selectFirst(rule.monthSelector()));
                if (day.isEmpty() || month.isEmpty()) {
                    continue;
                }
                entries.add(new RawEntry(day, month, extractNote(entry, rule)));
            }
            harvests.add(new StreamHarvest(rule, instructions, notice, entries));
        }
        return harvests;
    }

    private List<Instruction> extractInstructions(Elements block) {
        Element detail = block.select(StreamRules.DETAIL_BLOCK).first();
        if (detail == null) {
            return List.of();
        }
        List<Instruction> instructions = new ArrayList<>();
        for (Element paragraph : detail.select(StreamRules.INSTRUCTION_PARAGRAPH)) {
            String text = instructionText(paragraph);
            if (text.isEmpty()) {
                continue;
            }
            instructions.add(new Instruction(text, extractLinks(paragraph)));
        }
        return instructions;
    }

    /**
     * Joins the paragraph's child nodes with spaces so that inline links don't glue onto adjacent words.
     */
    static String instructionText(Element paragraph) {
        List<String> parts = new ArrayList<>();
        for (Node child : paragraph.childNodes()) {
            String value = "";
            if (child instanceof TextNode textNode) {
                value = textNode.text().trim();
            } else if (child instanceof Element element) {
                value = element.text().trim();
            }
            if (!value.isEmpty()) {
                parts.add(value);
            }
        }
        return HtmlUtils.normalizeSpaces(String.join(" ", parts));
    }

    /**
     * Resolves each anchor against the document's base URI. An href jsoup cannot resolve is kept verbatim.
     */
    static List<String> extractLinks(Element paragraph) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : paragraph.select("a[href]")) {
            String raw = anchor.attr("href").trim();
            if (raw.isEmpty()) {
                continue;
            }
            String resolved = anchor.absUrl("href");
            links.add(resolved.isEmpty() ? raw : resolved);
        }
        return List.copyOf(links);
    }

    private static String extractNotice(Elements block) {
        Element notice = block.select(StreamRules.NOTICE).first();
        return notice == null ? "" : HtmlUtils.normalizeSpaces(notice.text());
    }

    private static String extractNote(Element entry, StreamRule rule) {
        List<String> notes = new ArrayList<>();
        for (Element note : entry.select(StreamRules.ASTERISK_NOTE)) {
            if (note.is(rule.daySelector()) || note.is(rule.monthSelector())) {
                continue;
            }
            String classes = note.className();
            if (classes.contains("collection-day") || classes.contains("collection-month")) {
                continue;
            }
            String text = HtmlUtils.normalizeSpaces(note.text());
            if (!text.isEmpty()) {
                notes.add(text);
            }
        }
        return String.join(" ", notes);
    }

    private static String text(Element element) {
        return element == null ? "" : element.text().trim();
    }
}

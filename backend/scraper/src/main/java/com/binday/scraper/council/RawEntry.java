package com.binday.scraper.council;

/**
 * Unparsed date entry as printed on the page, with its asterisk footnote (empty when absent).
 */
public record RawEntry(String day, String month, String note) {
}

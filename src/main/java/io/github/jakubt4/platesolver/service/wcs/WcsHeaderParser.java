package io.github.jakubt4.platesolver.service.wcs;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a FITS-style header block into an ordered key/value map.
 *
 * <p>Accepts newline-delimited {@code KEY = VALUE / comment} lines as well as the
 * raw 80-column card images solve-field writes without line breaks. Commentary
 * cards ({@code COMMENT}, {@code HISTORY}, blank keyword), {@code END}, lines
 * starting with {@code #} and cards without a value indicator are skipped.
 * String values lose their quotes and trailing padding. Keys are kept verbatim;
 * a repeated key keeps its last value.
 */
@Component
public class WcsHeaderParser {

    private static final int CARD_LENGTH = 80;
    private static final int KEYWORD_LENGTH = 8;
    private static final Set<String> COMMENTARY_KEYWORDS = Set.of("COMMENT", "HISTORY", "END");

    public Map<String, String> parse(final Path headerFile) {
        final String content;
        try {
            content = Files.readString(headerFile, StandardCharsets.ISO_8859_1);
        } catch (final IOException e) {
            throw new WcsParseException("cannot read WCS header " + headerFile + ": " + e.getMessage(), e);
        }
        return parse(content);
    }

    public Map<String, String> parse(final String content) {
        final var header = new LinkedHashMap<String, String>();
        for (final var card : cards(content)) {
            final var trimmed = card.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || isCommentary(card)) {
                continue;
            }
            final var equals = card.indexOf('=');
            if (equals < 0) {
                continue;
            }
            final var key = card.substring(0, equals).strip();
            if (key.isEmpty()) {
                continue;
            }
            header.put(key, value(card.substring(equals + 1)));
        }
        return header;
    }

    private static List<String> cards(final String content) {
        if (content.indexOf('\n') >= 0 || content.indexOf('\r') >= 0) {
            return content.lines().toList();
        }
        final var cards = new ArrayList<String>(content.length() / CARD_LENGTH + 1);
        for (var start = 0; start < content.length(); start += CARD_LENGTH) {
            cards.add(content.substring(start, Math.min(start + CARD_LENGTH, content.length())));
        }
        return cards;
    }

    private static boolean isCommentary(final String card) {
        if (card.length() >= KEYWORD_LENGTH && card.substring(0, KEYWORD_LENGTH).isBlank()) {
            return true;
        }
        final var stripped = card.stripLeading();
        final var end = stripped.indexOf(' ');
        final var keyword = end < 0 ? stripped : stripped.substring(0, end);
        return COMMENTARY_KEYWORDS.contains(keyword);
    }

    private static String value(final String field) {
        final var raw = withoutInlineComment(field).strip();
        if (raw.length() >= 2 && raw.charAt(0) == '\'') {
            final var close = raw.lastIndexOf('\'');
            final var inner = close > 0 ? raw.substring(1, close) : raw.substring(1);
            return inner.replace("''", "'").stripTrailing();
        }
        return raw;
    }

    private static String withoutInlineComment(final String field) {
        var inString = false;
        for (var i = 0; i < field.length(); i++) {
            final var c = field.charAt(i);
            if (c == '\'') {
                inString = !inString;
            } else if (c == '/' && !inString) {
                return field.substring(0, i);
            }
        }
        return field;
    }
}

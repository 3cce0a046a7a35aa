package com.openforge.memorylane.retrieval;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses entity filters from free query text: capitalised words, quoted strings
 * and {@code project: X} / {@code person: X} phrases, first-seen order, no repeats.
 */
@Component
public class QueryEntityExtractor {

    private static final Pattern CAPITALISED = Pattern.compile("\\b[A-Z][A-Za-z0-9]+\\b");
    private static final Pattern QUOTED      = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern LABELLED    =
            Pattern.compile("\\b(?:project|person)\\s*:\\s*\"?([^\",.;?!]+)\"?", Pattern.CASE_INSENSITIVE);

    public List<String> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> entities = new LinkedHashSet<>();
        collect(CAPITALISED, 0, text, entities);
        collect(QUOTED,      1, text, entities);
        collect(LABELLED,    1, text, entities);
        return new ArrayList<>(entities);
    }

    private static void collect(Pattern pattern, int group, String text, Set<String> into) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            String value = m.group(group).trim();
            if (!value.isEmpty()) into.add(value);
        }
    }
}

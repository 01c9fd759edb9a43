package com.factguard.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits normalized text into sentences.
 * Decimal numbers ("3.5"), single-letter initials ("U.S.") and common abbreviations
 * do not end a sentence; line breaks always do.
 */
@Component
public class SentenceSplitter {

    private static final Pattern BOUNDARY = Pattern.compile("[.!?]+[\"')\\]]*(?=\\s|$)");

    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "vs", "etc", "inc", "ltd", "co",
            "corp", "e.g", "i.e", "approx", "fig", "jan", "feb", "mar", "apr", "jun",
            "jul", "aug", "sep", "sept", "oct", "nov", "dec"
    );

    public List<String> split(String text) {
        List<String> sentences = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return sentences;
        }

        for (String line : text.split("\\n+")) {
            splitLine(line, sentences);
        }
        return sentences;
    }

    private void splitLine(String line, List<String> out) {
        Matcher matcher = BOUNDARY.matcher(line);
        int start = 0;
        while (matcher.find()) {
            int end = matcher.end();
            String candidate = line.substring(start, end);
            if (isAbbreviation(candidate, matcher.start() - start)) {
                continue;
            }
            addIfNotBlank(candidate, out);
            start = end;
        }
        if (start < line.length()) {
            addIfNotBlank(line.substring(start), out);
        }
    }

    private boolean isAbbreviation(String candidate, int punctuationIndex) {
        if (punctuationIndex <= 0 || candidate.charAt(punctuationIndex) != '.') {
            return false;
        }
        int wordStart = punctuationIndex;
        while (wordStart > 0 && !Character.isWhitespace(candidate.charAt(wordStart - 1))) {
            wordStart--;
        }
        String word = candidate.substring(wordStart, punctuationIndex).toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return false;
        }
        // Initials: "J." or "U.S"
        if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
            return true;
        }
        if (word.matches("(\\p{L}\\.)+\\p{L}")) {
            return true;
        }
        return ABBREVIATIONS.contains(word.replaceAll("^[(\"']+", ""));
    }

    private void addIfNotBlank(String sentence, List<String> out) {
        String trimmed = sentence.strip();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }
}

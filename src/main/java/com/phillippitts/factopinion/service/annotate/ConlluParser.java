package com.phillippitts.factopinion.service.annotate;

import com.phillippitts.factopinion.exception.AnnotationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses CoNLL-U text into {@link AnnotatedWord}s.
 *
 * <p>Comment lines and blank lines are ignored. Multi-word token ranges ({@code 1-2}) and empty
 * nodes ({@code 1.1}) are skipped because they carry no syntactic relation of their own.
 */
final class ConlluParser {

    private static final int MIN_COLUMNS = 8;
    private static final int COL_ID = 0;
    private static final int COL_FORM = 1;
    private static final int COL_UPOS = 3;
    private static final int COL_FEATS = 5;
    private static final int COL_DEPREL = 7;
    private static final String EMPTY = "_";

    private ConlluParser() {}

    static List<AnnotatedWord> parse(String conllu) {
        if (conllu == null || conllu.isBlank()) {
            return List.of();
        }
        List<AnnotatedWord> words = new ArrayList<>();
        String[] lines = conllu.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] cols = line.split("\t");
            if (cols.length < MIN_COLUMNS) {
                throw new AnnotationException("Malformed CoNLL-U line " + (i + 1)
                        + ": expected at least " + MIN_COLUMNS + " columns, got " + cols.length);
            }
            String id = cols[COL_ID];
            if (id.contains("-") || id.contains(".")) {
                continue;
            }
            words.add(new AnnotatedWord(
                    cols[COL_FORM],
                    valueOrEmpty(cols[COL_UPOS]),
                    valueOrEmpty(cols[COL_DEPREL]),
                    parseFeatures(cols[COL_FEATS], i + 1)));
        }
        return List.copyOf(words);
    }

    private static Map<String, String> parseFeatures(String feats, int lineNo) {
        if (feats.isEmpty() || EMPTY.equals(feats)) {
            return Map.of();
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (String pair : feats.split("\\|")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) {
                throw new AnnotationException("Malformed feature '" + pair + "' on CoNLL-U line " + lineNo);
            }
            map.put(pair.substring(0, eq), pair.substring(eq + 1));
        }
        return map;
    }

    private static String valueOrEmpty(String column) {
        return EMPTY.equals(column) ? "" : column;
    }
}

package com.jreinhal.legaldoc.util;

import com.jreinhal.legaldoc.constant.StopWords;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer shared by indexing, sparse lookup, keyword reranking and claim checking, so that a
 * term produced at index time always matches the same term at query time.
 */
public final class TextTokenizer {
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+(?:['’][\\p{L}]+)?");
    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

    private TextTokenizer() {
    }

    /**
     * Lower-cased, stemmed tokens with stop words removed, in document order (duplicates kept).
     */
    public static List<String> terms(String text) {
        return terms(text, StopWords.RETRIEVAL);
    }

    public static List<String> terms(String text, Set<String> stopWords) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            int apostrophe = Math.max(token.indexOf('\''), token.indexOf('’'));
            if (apostrophe > 0) {
                token = token.substring(0, apostrophe);
            }
            if (token.length() < 2 && !Character.isDigit(token.charAt(0))) {
                continue;
            }
            if (stopWords.contains(token)) {
                continue;
            }
            out.add(stem(token));
        }
        return out;
    }

    public static Set<String> uniqueTerms(String text) {
        return new LinkedHashSet<>(terms(text));
    }

    public static Map<String, Integer> termFrequencies(List<String> terms) {
        Map<String, Integer> tf = new HashMap<>();
        for (String term : terms) {
            tf.merge(term, 1, Integer::sum);
        }
        return tf;
    }

    /**
     * Numeric tokens ("21", "1983", "5") as they appear in the text. Used to catch article and
     * section numbers that do not match the evidence.
     */
    public static Set<String> numbers(String text) {
        Set<String> out = new LinkedHashSet<>();
        if (text == null) {
            return out;
        }
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            out.add(matcher.group());
        }
        return out;
    }

    // light suffix stripping; enough for "rights"/"right", "amended"/"amend"
    static String stem(String token) {
        if (token.length() <= 4 || Character.isDigit(token.charAt(0))) {
            return token;
        }
        if (token.endsWith("ies") && token.length() > 5) {
            return token.substring(0, token.length() - 3) + "y";
        }
        if (token.endsWith("ing") && token.length() > 6) {
            return token.substring(0, token.length() - 3);
        }
        if (token.endsWith("ed") && token.length() > 5) {
            return token.substring(0, token.length() - 2);
        }
        if (token.endsWith("es") && (token.endsWith("sses") || token.endsWith("ches") || token.endsWith("shes"))) {
            return token.substring(0, token.length() - 2);
        }
        if (token.endsWith("s") && !token.endsWith("ss") && !token.endsWith("us") && !token.endsWith("is")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}

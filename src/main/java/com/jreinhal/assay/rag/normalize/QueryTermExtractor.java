package com.jreinhal.assay.rag.normalize;

import com.jreinhal.assay.constant.StopWords;
import com.jreinhal.assay.rag.alias.AliasCatalog;
import com.jreinhal.assay.rag.alias.AliasCatalog.CatalogEntry;
import com.jreinhal.assay.util.TextFolding;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Pulls candidate terms out of a question: phrases that literally name a catalog alias, numeric
 * values with a unit, and remaining content words that may still match an alias fuzzily.
 */
@Component
public class QueryTermExtractor {
    private static final int MAX_NGRAM = 3;
    private static final int MIN_CONTENT_WORD = 4;
    private static final int MAX_CANDIDATES = 12;

    private static final Pattern VALUE_WITH_UNIT = Pattern.compile(
            "\\d+(?:[.,]\\d+)?\\s*(?:[-–]\\s*\\d+(?:[.,]\\d+)?\\s*|(?:a|to|ate)\\s+\\d+(?:[.,]\\d+)?\\s*)?"
                    + "(?:microns?|micrometers?|micrometros?|um|µm|μm|nm|mpa\\.s|pa\\.s|pa·s|mpa|gpa|kpa|hv|%|°c|min|h)(?![a-z])");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}\\-_]+");
    private static final Pattern NUMERIC = Pattern.compile("[\\d.,\\-]+");

    private final TermNormalizer normalizer;
    private final AliasCatalog catalog;

    public QueryTermExtractor(TermNormalizer normalizer, AliasCatalog catalog) {
        this.normalizer = normalizer;
        this.catalog = catalog;
    }

    public ExtractedTerms extract(String query) {
        String folded = TextFolding.fold(query);
        List<Term> valueTerms = new ArrayList<>();
        Matcher values = VALUE_WITH_UNIT.matcher(folded);
        while (values.find()) {
            valueTerms.add(this.normalizer.normalize(values.group().trim()));
        }
        String withoutValues = VALUE_WITH_UNIT.matcher(folded).replaceAll(" ");

        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(withoutValues)) {
            String cleaned = stripEdges(token);
            if (!cleaned.isEmpty()) {
                tokens.add(cleaned);
            }
        }

        Set<String> aliasForms = aliasForms();
        Map<String, Term> candidates = new LinkedHashMap<>();
        boolean[] consumed = new boolean[tokens.size()];
        for (int n = Math.min(MAX_NGRAM, tokens.size()); n >= 1; n--) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                if (anyConsumed(consumed, i, n)) {
                    continue;
                }
                String phrase = String.join(" ", tokens.subList(i, i + n));
                if (aliasForms.contains(phrase)) {
                    candidates.putIfAbsent(phrase, this.normalizer.normalize(phrase));
                    for (int j = i; j < i + n; j++) {
                        consumed[j] = true;
                    }
                }
            }
        }
        for (int i = 0; i < tokens.size() && candidates.size() < MAX_CANDIDATES; i++) {
            String token = tokens.get(i);
            if (consumed[i] || token.length() < MIN_CONTENT_WORD || StopWords.TERM_EXTRACTION.contains(token)
                    || NUMERIC.matcher(token).matches()) {
                continue;
            }
            candidates.putIfAbsent(token, this.normalizer.normalize(token));
        }
        return new ExtractedTerms(List.copyOf(candidates.values()), List.copyOf(valueTerms));
    }

    private Set<String> aliasForms() {
        Set<String> forms = new HashSet<>();
        for (CatalogEntry entry : this.catalog.entries()) {
            forms.add(TextFolding.fold(entry.canonicalKey().replace('_', ' ')));
            for (String alias : entry.aliases()) {
                forms.add(TextFolding.fold(alias));
            }
        }
        return forms;
    }

    private static boolean anyConsumed(boolean[] consumed, int from, int length) {
        for (int i = from; i < from + length; i++) {
            if (consumed[i]) {
                return true;
            }
        }
        return false;
    }

    private static String stripEdges(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && (token.charAt(start) == '-' || token.charAt(start) == '_')) {
            start++;
        }
        while (end > start && (token.charAt(end - 1) == '-' || token.charAt(end - 1) == '_')) {
            end--;
        }
        return token.substring(start, end);
    }

    /**
     * Metric candidates go through alias resolution; value terms only carry normalized values.
     */
    public record ExtractedTerms(List<Term> metricCandidates, List<Term> valueTerms) {
    }
}

package com.jreinhal.assay.rag.normalize;

import com.jreinhal.assay.util.TextFolding;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Folds a raw term (case, accents, whitespace) and rewrites a single value with a unit into the
 * canonical unit used by stored measurements.
 *
 * <p>Rules are evaluated in list order and the first applicable one wins, so at most one rule
 * fires per term. Range expressions come first: converting only one end of "10-20 microns"
 * would produce a term that matches nothing, so ranges are left as typed. Every rewrite produces
 * a form its own predicate rejects, which makes normalization idempotent.</p>
 */
@Component
public class TermNormalizer {
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private static final Pattern DASH_RANGE = Pattern.compile("\\d\\s*[-–—]\\s*\\d");
    private static final Pattern WORD_RANGE = Pattern.compile("\\d\\s+(?:a|to|ate)\\s+\\d");
    private static final Pattern MICRON_VALUE = Pattern.compile(
            "(\\d+(?:[.,]\\d+)?)\\s*(?:microns?|micrometers?|micrometros?|um|µm|μm)\\b");
    private static final Pattern PAS_VALUE = Pattern.compile(
            "(\\d+(?:[.,]\\d+)?)\\s*(?<![a-z])pa\\s*[.·]\\s*s\\b");

    private static final List<Rule> RULES = List.of(
            new Rule(NormalizationRule.RANGE_DETECTED_SKIP,
                    s -> DASH_RANGE.matcher(s).find() || WORD_RANGE.matcher(s).find(),
                    UnaryOperator.identity()),
            new Rule(NormalizationRule.MICRON_TO_NM,
                    s -> !s.contains("nm") && MICRON_VALUE.matcher(s).find(),
                    s -> scaleUnit(s, MICRON_VALUE, "nm")),
            new Rule(NormalizationRule.PAS_TO_MPAS,
                    s -> !s.contains("mpa") && PAS_VALUE.matcher(s).find(),
                    s -> scaleUnit(s, PAS_VALUE, "mpa.s"))
    );

    public Term normalize(String raw) {
        String folded = TextFolding.fold(raw);
        for (Rule rule : RULES) {
            if (rule.applies().test(folded)) {
                return new Term(raw, rule.rewrite().apply(folded), rule.tag());
            }
        }
        return new Term(raw, folded, null);
    }

    private static String scaleUnit(String text, Pattern pattern, String targetUnit) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            BigDecimal value = new BigDecimal(matcher.group(1).replace(',', '.'));
            String scaled = value.multiply(THOUSAND).stripTrailingZeros().toPlainString();
            matcher.appendReplacement(out, Matcher.quoteReplacement(scaled + " " + targetUnit));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private record Rule(NormalizationRule tag, Predicate<String> applies, UnaryOperator<String> rewrite) {
    }
}

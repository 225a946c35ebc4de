package com.jreinhal.assay.rag.grounding;

import com.jreinhal.assay.config.GroundingProperties;
import com.jreinhal.assay.rag.evidence.EvidenceGraph;
import com.jreinhal.assay.rag.evidence.EvidenceGraph.MeasurementNode;
import com.jreinhal.assay.rag.intent.QueryIntent;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import com.jreinhal.assay.util.NumberFormats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that the numbers a drafted answer states can be traced to evidence.
 *
 * <p>The valid set holds the raw and canonical value of every measurement in the graph, in dot and
 * comma form, plus every number appearing in the source texts shown to the generator. A token is
 * grounded when it matches a valid string or lies within the configured tolerance of a valid value.
 * Small integers and year-like integers are not checked. More ungrounded tokens than
 * {@code maxUngrounded} fail verification.</p>
 */
@Component
public class NumericGroundingVerifier {
    private static final Logger log = LoggerFactory.getLogger(NumericGroundingVerifier.class);
    static final String FAILURE_TAG = "NUMERIC_GROUNDING_FAILED";
    private static final int MAX_EXAMPLES = 5;

    static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?");
    static final Pattern CITATION_MARKER = Pattern.compile("\\[\\d+(?:\\s*[,;]\\s*\\d+)*\\]");

    private final GroundingProperties properties;
    private final ReasoningTracer reasoningTracer;

    public NumericGroundingVerifier(GroundingProperties properties, ReasoningTracer reasoningTracer) {
        this.properties = properties;
        this.reasoningTracer = reasoningTracer;
    }

    /**
     * Applies the verification policy first: a query that is navigational or carries no quantitative
     * signal is not checked unless the graph holds measurements.
     */
    public VerificationResult verify(String answer, EvidenceGraph graph, Collection<String> evidenceTexts,
                                     QueryIntent intent) {
        boolean nonQuantitative = intent.navigational() || !intent.quantitative();
        if (nonQuantitative && graph.measurementCount() == 0) {
            log.debug("Numeric verification skipped for non-quantitative query");
            this.reasoningTracer.addStep(StepType.VERIFICATION, "Numeric verification", "skipped", 0L);
            return VerificationResult.skipped("non-quantitative query");
        }
        return verify(answer, graph, evidenceTexts);
    }

    public VerificationResult verify(String answer, EvidenceGraph graph, Collection<String> evidenceTexts) {
        long start = System.currentTimeMillis();
        if (answer == null || answer.isBlank()) {
            return new VerificationResult(true, List.of(), List.of());
        }
        Set<String> validStrings = new HashSet<>();
        List<Double> validValues = new ArrayList<>();
        for (MeasurementNode m : graph.allMeasurements()) {
            addValid(m.value(), validStrings, validValues);
            if (m.valueCanonical() != null) {
                addValid(m.valueCanonical(), validStrings, validValues);
            }
        }
        for (String text : evidenceTexts) {
            if (text == null) {
                continue;
            }
            Matcher matcher = NUMBER.matcher(text);
            while (matcher.find()) {
                validStrings.add(matcher.group());
                Double value = NumberFormats.parseLenient(matcher.group());
                if (value != null) {
                    addValid(value, validStrings, validValues);
                }
            }
        }

        List<String> ungrounded = new ArrayList<>();
        int checked = 0;
        Matcher matcher = NUMBER.matcher(stripCitationMarkers(answer));
        while (matcher.find()) {
            String token = matcher.group();
            Double value = NumberFormats.parseLenient(token);
            if (value == null || isExempt(token, value)) {
                continue;
            }
            checked++;
            if (!isGrounded(token, value, validStrings, validValues)) {
                ungrounded.add(token);
            }
        }

        List<String> issues = new ArrayList<>();
        boolean verified = ungrounded.size() <= this.properties.getMaxUngrounded();
        if (!verified) {
            issues.add(FAILURE_TAG + ": " + ungrounded.size() + " numeric values not traceable to evidence: "
                    + String.join(", ", ungrounded.subList(0, Math.min(MAX_EXAMPLES, ungrounded.size()))));
        }
        long elapsed = System.currentTimeMillis() - start;
        if (verified) {
            log.info("Numeric verification passed: {} values checked, {} ungrounded, {}ms", checked, ungrounded.size(), elapsed);
        } else {
            log.warn("Numeric verification failed: {} values checked, {} ungrounded, {}ms", checked, ungrounded.size(), elapsed);
        }
        this.reasoningTracer.addStep(StepType.VERIFICATION, "Numeric verification",
                verified ? "verified" : ungrounded.size() + " ungrounded values", elapsed,
                Map.of("checked", checked, "ungrounded", ungrounded.size(), "verified", verified));
        return new VerificationResult(verified, issues, ungrounded);
    }

    /**
     * Values a regeneration may use: every measurement value, raw and canonical.
     */
    public static List<String> groundedValues(EvidenceGraph graph) {
        Set<String> values = new LinkedHashSet<>();
        for (MeasurementNode m : graph.allMeasurements()) {
            String raw = NumberFormats.plain(m.value());
            values.add(m.unit() != null ? raw + " " + m.unit() : raw);
            if (m.valueCanonical() != null) {
                String canonical = NumberFormats.plain(m.valueCanonical());
                values.add(m.unitCanonical() != null ? canonical + " " + m.unitCanonical() : canonical);
            }
        }
        return new ArrayList<>(values);
    }

    static String stripCitationMarkers(String text) {
        return CITATION_MARKER.matcher(text).replaceAll(" ");
    }

    private boolean isExempt(String token, double value) {
        boolean integer = token.indexOf('.') < 0 && token.indexOf(',') < 0;
        if (!integer) {
            return false;
        }
        if (value <= this.properties.getSmallIntegerCeiling()) {
            return true;
        }
        return token.length() == 4 && value >= this.properties.getYearMin() && value <= this.properties.getYearMax();
    }

    private boolean isGrounded(String token, double value, Set<String> validStrings, List<Double> validValues) {
        if (validStrings.contains(token) || validStrings.contains(token.replace(',', '.'))) {
            return true;
        }
        double tolerance = this.properties.getTolerance();
        for (double valid : validValues) {
            if (Math.abs(valid - value) <= tolerance) {
                return true;
            }
        }
        return false;
    }

    private static void addValid(double value, Set<String> validStrings, List<Double> validValues) {
        validStrings.addAll(NumberFormats.decimalVariants(value));
        validValues.add(value);
    }
}

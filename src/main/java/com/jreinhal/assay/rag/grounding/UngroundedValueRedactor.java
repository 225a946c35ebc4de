package com.jreinhal.assay.rag.grounding;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import org.springframework.stereotype.Component;

/**
 * Degrades an answer that failed numeric verification: every ungrounded number is replaced by a
 * placeholder and a hedging note is appended. Citation markers are left alone.
 */
@Component
public class UngroundedValueRedactor {
    static final String PLACEHOLDER = "[unverified value]";
    static final String HEDGE_NOTE = "\n\n> Note: some numeric values in this answer could not be traced to the "
            + "available evidence and were withheld. Check the cited sources for exact figures.";

    public String redact(String answer, List<String> ungroundedValues) {
        if (answer == null || ungroundedValues.isEmpty()) {
            return answer;
        }
        Set<String> targets = new HashSet<>(ungroundedValues);
        StringBuilder out = new StringBuilder(answer.length() + HEDGE_NOTE.length());
        int last = 0;
        Matcher markers = NumericGroundingVerifier.CITATION_MARKER.matcher(answer);
        while (markers.find()) {
            redactSegment(answer.substring(last, markers.start()), targets, out);
            out.append(markers.group());
            last = markers.end();
        }
        redactSegment(answer.substring(last), targets, out);
        return out.append(HEDGE_NOTE).toString();
    }

    private static void redactSegment(String segment, Set<String> targets, StringBuilder out) {
        Matcher numbers = NumericGroundingVerifier.NUMBER.matcher(segment);
        int last = 0;
        while (numbers.find()) {
            if (targets.contains(numbers.group())) {
                out.append(segment, last, numbers.start()).append(PLACEHOLDER);
                last = numbers.end();
            }
        }
        out.append(segment.substring(last));
    }
}

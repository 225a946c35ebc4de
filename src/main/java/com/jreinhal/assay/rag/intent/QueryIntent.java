package com.jreinhal.assay.rag.intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record QueryIntent(boolean tabularLookup,
                          boolean comparative,
                          boolean interpretiveDeepReasoning,
                          boolean navigational,
                          boolean quantitative,
                          List<String> interpretiveKeywords,
                          List<NumericTarget> numericTargets,
                          List<String> targetMaterials,
                          String targetFeature,
                          int complexityPoints,
                          ComplexityTier tier,
                          EvidenceMode evidenceMode) {

    public QueryIntent {
        interpretiveKeywords = List.copyOf(interpretiveKeywords);
        numericTargets = List.copyOf(numericTargets);
        targetMaterials = List.copyOf(targetMaterials);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tabular_lookup", tabularLookup);
        map.put("comparative", comparative);
        map.put("interpretive_deep_reasoning", interpretiveDeepReasoning);
        map.put("navigational", navigational);
        map.put("quantitative", quantitative);
        map.put("evidence_mode", evidenceMode.name());
        if (!interpretiveKeywords.isEmpty()) {
            map.put("interpretive_keywords", interpretiveKeywords);
        }
        if (!numericTargets.isEmpty()) {
            map.put("numeric_targets", numericTargets.stream().map(NumericTarget::value).toList());
        }
        if (!targetMaterials.isEmpty()) {
            map.put("target_materials", targetMaterials);
        }
        if (targetFeature != null) {
            map.put("target_feature", targetFeature);
        }
        return map;
    }
}

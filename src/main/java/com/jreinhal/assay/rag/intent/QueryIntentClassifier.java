package com.jreinhal.assay.rag.intent;

import com.jreinhal.assay.model.ConversationTurn;
import com.jreinhal.assay.reasoning.ReasoningStep.StepType;
import com.jreinhal.assay.reasoning.ReasoningTracer;
import com.jreinhal.assay.util.LogSanitizer;
import com.jreinhal.assay.util.NumberFormats;
import com.jreinhal.assay.util.TextFolding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rule-based intent detection for Portuguese and English questions.
 *
 * <p>All rules run against folded text (lower case, no accents), so keyword lists are written
 * without diacritics. The result drives the complexity tier (token and context budgets) and the
 * evidence mode (whether the evidence graph is built and required).</p>
 */
@Service
public class QueryIntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryIntentClassifier.class);

    // === INTERPRETIVE (IDER) SIGNALS ===

    private static final List<String> INTERPRETIVE_TERMS = List.of(
            // pt
            "o que isso ensina", "o que isso demonstra", "o que demonstrou", "o que aprendemos",
            "licao", "licoes", "implicacao", "implicacoes", "interprete", "interpretar",
            "por que aconteceu", "por que ocorreu", "significado", "conclusao pratica",
            "o que os dados mostram", "o que os resultados mostram", "analise profunda",
            "analise detalhada", "o que podemos concluir", "o que se pode concluir",
            "trade-off", "trade offs", "tradeoff", "efeito observado",
            // en
            "what does this teach", "what did it show", "what we learned", "what it demonstrated",
            "implication", "lesson", "interpret", "why did it happen", "what the data shows",
            "deep analysis", "practical conclusion", "what can we conclude", "observed effect");

    // "what did this experiment demonstrate", "o que esse experimento demonstrou"
    private static final List<Pattern> INTERPRETIVE_PATTERNS = List.of(
            Pattern.compile("\\bwhat\\s+(did|does|do)\\s+(this|that|these|those|the|it|our)\\b(\\s+\\w+){0,3}\\s+"
                    + "(show|teach|demonstrate|reveal|prove|indicate|imply|tell us)\\b"),
            Pattern.compile("\\bo\\s+que\\s+(esse|este|essa|esta|esses|estes|isso|o|a|os|as|nosso|nossa)\\b(\\s+\\w+){0,3}\\s+"
                    + "(demonstrou|demonstra|mostrou|mostra|ensinou|ensina|revelou|indicou|indica|provou|implica)\\b"));

    private static final Pattern EXPERIMENT_CONTEXT = Pattern.compile(
            "\\b(experimento|experiment|tabela|table|aba|excel|sheet|planilha|ensaio|trial)s?\\b|\\bteste\\b");
    private static final Pattern DEEP_ANALYSIS = Pattern.compile(
            "\\b(analise|analyze|analyse|explique|explain|detalhe|detail|resuma|summarize)\\b.*"
                    + "\\b(resultado|result|dado|data|experiment|experimento|ensaio)");

    // === TABULAR SIGNALS ===

    private static final List<String> FILLER_KEYWORDS = List.of(
            "carga", "filler", "wt%", "filled", "glass", "vidro", "ceramic", "ceramica",
            "conteudo de carga", "teor de carga", "filler content", "filler fraction");
    private static final List<String> TABLE_KEYWORDS = List.of(
            "experimento", "experiment", "tabela", "table", "excel", "aba", "sheet", "planilha",
            "formulacao", "formulation", "composicao", "composition", "variacao");
    private static final Pattern TRANSITION = Pattern.compile(
            "\\bde\\s+~?\\d.*\\bpara\\s+~?\\d|\\bfrom\\s+~?\\d.*\\bto\\s+~?\\d"
                    + "|\\b(reduz|aument|vari|mud|alter)\\w*|\\b(reduced|increased|varied|changed|lowered|raised)\\b");
    private static final List<Pattern> NUMERIC_TARGET_PATTERNS = List.of(
            Pattern.compile("(\\d+(?:[.,]\\d+)?)\\s*%"),
            Pattern.compile("\\bde\\s+~?(\\d+(?:[.,]\\d+)?)\\s*%?\\s+para\\s+~?(\\d+(?:[.,]\\d+)?)"),
            Pattern.compile("\\bfrom\\s+~?(\\d+(?:[.,]\\d+)?)\\s*%?\\s+to\\s+~?(\\d+(?:[.,]\\d+)?)"),
            Pattern.compile("~(\\d+(?:[.,]\\d+)?)\\s*%?\\s*(?:para|to|→|->|a)\\s*~?(\\d+(?:[.,]\\d+)?)"));
    private static final List<String> MATERIALS = List.of(
            "vitality", "filtek", "charisma", "tetric", "grandio", "z350", "z250",
            "brilliant", "herculite", "clearfil", "estelite", "ips", "ceram");

    // === COMPARATIVE / NAVIGATIONAL / QUANTITATIVE ===

    private static final Pattern COMPARATIVE = Pattern.compile(
            "\\b(compare|compared|comparing|comparison|comparar|compara|comparacao|comparativo|versus|vs\\.?"
                    + "|difference|differences|diferenca|diferencas|better|worse|melhor|pior"
                    + "|higher than|lower than|maior que|menor que)\\b");

    private static final List<Pattern> NAVIGATIONAL_PATTERNS = List.of(
            Pattern.compile("^(quais sao|liste|listar|resuma|me de um resumo|qual o status|sobre o que e|quem trabalhou)\\b"),
            Pattern.compile("^(list|summarize|what is the status|what is this about|who worked)\\b"),
            Pattern.compile("\\b(quais|which)\\s+(projetos|experimentos|documentos|arquivos|projects|experiments|documents|files)\\b"),
            Pattern.compile("^(ola|oi|bom dia|boa tarde|boa noite|ajuda|hello|hi|hey|help)\\b"));

    private static final Pattern QUANTITATIVE = Pattern.compile(
            "\\b(valor|valores|quanto|quanta|quantos|medida|resistencia|modulo|dureza|percentual|porcentagem"
                    + "|mpa|gpa|kpa|vickers|knoop|conversao|cor|amarelamento|estabilidade|encolhimento|contracao"
                    + "|viscosidade|value|values|how much|how many|measure|measured|strength|modulus|hardness"
                    + "|percent|percentage|conversion|color|colour|yellowing|stability|shrinkage|viscosity|nm)\\b|%");

    private final ReasoningTracer reasoningTracer;

    public QueryIntentClassifier(ReasoningTracer reasoningTracer) {
        this.reasoningTracer = reasoningTracer;
    }

    /**
     * @param targetMetricCount number of canonical metrics the alias resolver found in the query
     */
    public QueryIntent classify(String query, List<ConversationTurn> history, int targetMetricCount) {
        long start = System.currentTimeMillis();
        String q = TextFolding.fold(query);

        List<String> interpretiveKeywords = interpretiveKeywords(q);
        boolean ider = !interpretiveKeywords.isEmpty()
                || (EXPERIMENT_CONTEXT.matcher(q).find() && DEEP_ANALYSIS.matcher(q).find());

        List<NumericTarget> numericTargets = numericTargets(q);
        boolean hasFiller = FILLER_KEYWORDS.stream().anyMatch(q::contains);
        boolean hasTable = TABLE_KEYWORDS.stream().anyMatch(q::contains);
        boolean twoNumbers = numericTargets.size() >= 2;
        boolean tabular = ((hasTable || hasFiller) && (twoNumbers || TRANSITION.matcher(q).find()))
                || (q.contains("experiment") && twoNumbers);
        List<String> materials = MATERIALS.stream().filter(q::contains).toList();

        boolean comparative = COMPARATIVE.matcher(q).find();
        boolean navigational = NAVIGATIONAL_PATTERNS.stream().anyMatch(p -> p.matcher(q).find());
        boolean quantitative = QUANTITATIVE.matcher(q).find();

        long dialogueTurns = history == null ? 0 : history.stream().filter(ConversationTurn::isDialogue).count();
        int points = 0;
        if (ider) {
            points += 2;
        }
        if (targetMetricCount >= 2) {
            points++;
        }
        if (targetMetricCount >= 4) {
            points++;
        }
        if (comparative) {
            points++;
        }
        if (dialogueTurns >= 4) {
            points++;
        }
        ComplexityTier tier = points == 0 ? ComplexityTier.SIMPLE : (points <= 2 ? ComplexityTier.STANDARD : ComplexityTier.DEEP);
        boolean full = ider || tabular || (comparative && targetMetricCount > 0)
                || tier == ComplexityTier.DEEP || targetMetricCount > 0;
        EvidenceMode mode = full ? EvidenceMode.FULL : EvidenceMode.CHUNK_ONLY;

        QueryIntent intent = new QueryIntent(tabular, comparative, ider, navigational, quantitative,
                interpretiveKeywords, numericTargets, materials, hasFiller ? "filler_content" : null,
                points, tier, mode);

        long elapsed = System.currentTimeMillis() - start;
        log.info("Intent for query {}: ider={}, tabular={}, comparative={}, tier={}, mode={}",
                LogSanitizer.querySummary(query), ider, tabular, comparative, tier, mode);
        Map<String, Object> data = new LinkedHashMap<>(intent.toMap());
        data.put("complexityPoints", points);
        this.reasoningTracer.addStep(StepType.QUERY_ROUTING, "Intent classification",
                tier + " / " + mode, elapsed, data);
        return intent;
    }

    private static List<String> interpretiveKeywords(String q) {
        Set<String> found = new LinkedHashSet<>();
        for (String term : INTERPRETIVE_TERMS) {
            if (q.contains(term)) {
                found.add(term);
            }
        }
        for (Pattern pattern : INTERPRETIVE_PATTERNS) {
            Matcher m = pattern.matcher(q);
            if (m.find()) {
                found.add(m.group().trim());
            }
        }
        return new ArrayList<>(found);
    }

    static List<NumericTarget> numericTargets(String foldedQuery) {
        Set<Double> values = new LinkedHashSet<>();
        for (Pattern pattern : NUMERIC_TARGET_PATTERNS) {
            Matcher m = pattern.matcher(foldedQuery);
            while (m.find()) {
                for (int i = 1; i <= m.groupCount(); i++) {
                    Double value = NumberFormats.parseLenient(m.group(i));
                    if (value != null) {
                        values.add(value);
                    }
                }
            }
        }
        return values.stream().map(NumericTarget::of).toList();
    }
}

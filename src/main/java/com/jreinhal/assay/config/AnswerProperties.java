package com.jreinhal.assay.config;

import com.jreinhal.assay.rag.intent.ComplexityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "assay.answer")
public class AnswerProperties {
    private int minQueryLength = 5;

    /**
     * Number of most recent user/assistant turns forwarded to the generator.
     */
    private int historyWindow = 6;

    private int simpleMaxTokens = 1200;

    private int standardMaxTokens = 2000;

    private int deepMaxTokens = 3000;

    private int simpleChunkBudget = 8;

    private int standardChunkBudget = 12;

    private int deepChunkBudget = 15;

    private long generationTimeoutMs = 60000;

    private int criticalDocumentCap = 3;

    /**
     * Source text longer than this is cut before it goes into the prompt.
     */
    private int sourceTextMaxChars = 2500;

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public void setMinQueryLength(int minQueryLength) {
        this.minQueryLength = minQueryLength;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public int getSimpleMaxTokens() {
        return simpleMaxTokens;
    }

    public void setSimpleMaxTokens(int simpleMaxTokens) {
        this.simpleMaxTokens = simpleMaxTokens;
    }

    public int getStandardMaxTokens() {
        return standardMaxTokens;
    }

    public void setStandardMaxTokens(int standardMaxTokens) {
        this.standardMaxTokens = standardMaxTokens;
    }

    public int getDeepMaxTokens() {
        return deepMaxTokens;
    }

    public void setDeepMaxTokens(int deepMaxTokens) {
        this.deepMaxTokens = deepMaxTokens;
    }

    public int getSimpleChunkBudget() {
        return simpleChunkBudget;
    }

    public void setSimpleChunkBudget(int simpleChunkBudget) {
        this.simpleChunkBudget = simpleChunkBudget;
    }

    public int getStandardChunkBudget() {
        return standardChunkBudget;
    }

    public void setStandardChunkBudget(int standardChunkBudget) {
        this.standardChunkBudget = standardChunkBudget;
    }

    public int getDeepChunkBudget() {
        return deepChunkBudget;
    }

    public void setDeepChunkBudget(int deepChunkBudget) {
        this.deepChunkBudget = deepChunkBudget;
    }

    public long getGenerationTimeoutMs() {
        return generationTimeoutMs;
    }

    public void setGenerationTimeoutMs(long generationTimeoutMs) {
        this.generationTimeoutMs = generationTimeoutMs;
    }

    public int getCriticalDocumentCap() {
        return criticalDocumentCap;
    }

    public void setCriticalDocumentCap(int criticalDocumentCap) {
        this.criticalDocumentCap = criticalDocumentCap;
    }

    public int getSourceTextMaxChars() {
        return sourceTextMaxChars;
    }

    public void setSourceTextMaxChars(int sourceTextMaxChars) {
        this.sourceTextMaxChars = sourceTextMaxChars;
    }

    public int maxTokensFor(ComplexityTier tier) {
        return switch (tier) {
            case SIMPLE -> simpleMaxTokens;
            case STANDARD -> standardMaxTokens;
            case DEEP -> deepMaxTokens;
        };
    }

    public int chunkBudgetFor(ComplexityTier tier) {
        return switch (tier) {
            case SIMPLE -> simpleChunkBudget;
            case STANDARD -> standardChunkBudget;
            case DEEP -> deepChunkBudget;
        };
    }
}

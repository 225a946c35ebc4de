package com.jreinhal.assay.rag.answer;

/**
 * A numbered source handed to the generator. {@code text} is what the prompt shows; the
 * response only carries an excerpt of it.
 */
public record Citation(int number, String type, String id, String title, String project, String text) {

    public Citation {
        text = text == null ? "" : text;
    }

    public String marker() {
        return "[" + number + "]";
    }

    public String excerpt(int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
}

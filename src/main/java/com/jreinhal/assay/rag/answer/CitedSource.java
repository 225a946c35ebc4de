package com.jreinhal.assay.rag.answer;

public record CitedSource(int citation, String type, String id, String title, String project, String excerpt) {
}

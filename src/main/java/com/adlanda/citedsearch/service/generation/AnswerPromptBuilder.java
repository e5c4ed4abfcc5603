package com.adlanda.citedsearch.service.generation;

import com.adlanda.citedsearch.config.GenerationProperties;
import com.adlanda.citedsearch.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the grounded answer prompt from the question and the retrieved passages.
 *
 * Passages are added in rank order until the configured context budget is used up; the
 * first passage is always included.
 */
@Component
public class AnswerPromptBuilder {

    private static final String GUIDELINES = """
            ### Response Guidelines:
            - Structure your response clearly, using bullet points or lists where appropriate.
            - Always answer in the same language as the question, even if the documents are in another language.
            - Include an inline citation in exactly this format [Filename, Page X] for every reference, regardless of the answer language.
            - Only use content that is relevant to the question and omit everything else.
            - Do not write phrases like "The provided information says" unless the information needed to answer is missing.

            ### Handling Special Cases:
            1. If the passages are not sufficient to answer the question, say so.
            2. If the question names a document that differs from the documents of the passages, tell the user \
            (in the language of the question): "Search over all documents was not successful. Please try again \
            by selecting the specific document."
            3. If the question names a document that none of the passages come from, explain that the passages \
            are likely not relevant and suggest selecting that document or asking more precisely.
            """;

    private final GenerationProperties generationProperties;

    public AnswerPromptBuilder(GenerationProperties generationProperties) {
        this.generationProperties = generationProperties;
    }

    public String build(String question, List<SearchResult> sources) {
        StringBuilder prompt = new StringBuilder()
                .append("You are a ").append(generationProperties.getAssistantRole())
                .append(". Answer the following question based on the provided passages.\n\n")
                .append("Question: ").append(question).append("\n\n")
                .append(GUIDELINES)
                .append("\n### Provided Data:\nPotentially relevant passages from the document search:\n");

        int budget = generationProperties.getMaxContextLength();
        int used = 0;
        for (SearchResult source : sources) {
            String passage = "\nFrom " + source.source() + ", Page " + source.page() + ": " + source.text() + "\n";
            if (used > 0 && used + passage.length() > budget) {
                break;
            }
            prompt.append(passage);
            used += passage.length();
        }
        return prompt.toString();
    }
}

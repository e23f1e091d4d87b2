package com.phillippitts.factopinion.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response body of {@code POST /api/v1/classify}.
 *
 * <p>{@code skipped} lists the input indexes left out of a partial batch; {@code error} is only
 * present on failure. Both are omitted when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassifyResponse(List<SentenceView> sentences, List<Integer> skipped, String error) {

    public ClassifyResponse {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        skipped = skipped == null || skipped.isEmpty() ? null : List.copyOf(skipped);
    }

    public static ClassifyResponse of(List<SentenceView> sentences, List<Integer> skipped) {
        return new ClassifyResponse(sentences, skipped, null);
    }

    public static ClassifyResponse failed(String error) {
        return new ClassifyResponse(List.of(), null, error);
    }
}

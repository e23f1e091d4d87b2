package com.phillippitts.factopinion.presentation.dto;

/**
 * Request body of {@code POST /api/v1/classify}. Blank and missing text are rejected by the
 * segmenter with a 400, so no bean validation is applied here.
 *
 * @param text Chinese text, one or more sentences
 */
public record ClassifyRequest(String text) {
}

/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - {@code POST /api/v1/classify}</li>
 *   <li>{@code presentation.dto} - request/response records for the API contract</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.presentation;

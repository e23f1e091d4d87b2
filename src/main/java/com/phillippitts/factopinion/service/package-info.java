/**
 * Service layer containing the fact/opinion pipeline.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.segment} - sentence segmentation</li>
 *   <li>{@code service.annotate} - dependency annotator interface and UDPipe adapter</li>
 *   <li>{@code service.rules} - lexical and syntactic rule scoring</li>
 *   <li>{@code service.ensemble} - classifier interface, remote adapter, ensemble averaging</li>
 *   <li>{@code service.fusion} - fusion of ensemble probability and logic score</li>
 *   <li>{@code service.dispatch} - concurrent per-sentence dispatch with order restoration</li>
 *   <li>{@code service.orchestration} - public entry point</li>
 *   <li>{@code service.metrics} - Micrometer instrumentation</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services are thread-safe; collaborators are read-only during scoring</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.service;

/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.factopinion.config.ThreadPoolConfig} - executor for concurrent
 *       sentence scoring</li>
 *   <li>{@link com.phillippitts.factopinion.config.ThreadPoolMetricsConfig} - pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code factopinion.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.annotate} - dependency annotator client</li>
 *   <li>{@code config.ensemble} - classifier ensemble members</li>
 *   <li>{@code config.pipeline} - scorer, fusion, dispatcher and orchestrator wiring</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.config;

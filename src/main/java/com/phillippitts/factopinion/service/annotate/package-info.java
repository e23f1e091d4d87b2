/**
 * Access to the external dependency parser.
 *
 * <p>{@link com.phillippitts.factopinion.service.annotate.DependencyAnnotator} is the narrow
 * interface the rule scorer consumes. {@link com.phillippitts.factopinion.service.annotate.UdpipeDependencyAnnotator}
 * talks to a UDPipe-compatible server and decodes its CoNLL-U output.
 *
 * <p>Configuration (application.properties):
 * <pre>
 * factopinion.annotator.base-url=http://localhost:8001
 * factopinion.annotator.model=chinese-gsd
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.service.annotate;

package com.phillippitts.factopinion.service.annotate;

import com.phillippitts.factopinion.exception.AnnotationException;

import java.util.List;

/**
 * Narrow view of an external tokenizer / tagger / dependency parser.
 *
 * <p>Only the four fields the rule scorer consumes are exposed, so the scorer does not depend on
 * the parser's full output shape.
 *
 * <p><b>Thread Safety:</b> implementations are invoked by several scoring tasks at once and must
 * be safe for concurrent use without external locking. The dispatcher relies on this.
 */
public interface DependencyAnnotator {

    /**
     * @param sentence a single sentence
     * @return annotated words in sentence order (may be empty)
     * @throws AnnotationException if the sentence cannot be annotated
     */
    List<AnnotatedWord> annotate(String sentence);
}

/**
 * Ensemble of trained sentence classifiers.
 *
 * <p>{@link com.phillippitts.factopinion.service.ensemble.SentenceClassifier} is the per-model
 * capability; {@link com.phillippitts.factopinion.service.ensemble.ClassifierEnsemble} averages
 * N of them element-wise. {@link com.phillippitts.factopinion.service.ensemble.RemoteSentenceClassifier}
 * calls one inference endpoint per member; the ensemble size is the number of configured
 * endpoints.
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.service.ensemble;

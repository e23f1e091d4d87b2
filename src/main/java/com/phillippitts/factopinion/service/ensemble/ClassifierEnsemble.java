package com.phillippitts.factopinion.service.ensemble;

import com.phillippitts.factopinion.exception.ClassifierException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Averages the distributions of N independently trained classifiers.
 *
 * <p>Every member is invoked for every sentence. A member that throws, returns null or returns
 * a vector that does not sum to 1 fails the whole call with a {@link ClassifierException}: the
 * ensemble never degrades silently to fewer members.
 *
 * <p>Thread-safe: the member list is immutable and members are required to be thread-safe.
 */
public class ClassifierEnsemble {

    private static final Logger LOG = LogManager.getLogger(ClassifierEnsemble.class);

    private final List<SentenceClassifier> members;

    /**
     * @param members one or more classifiers
     * @throws IllegalArgumentException if no member is given
     */
    public ClassifierEnsemble(List<? extends SentenceClassifier> members) {
        Objects.requireNonNull(members, "members");
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Ensemble requires at least one classifier");
        }
        this.members = List.copyOf(members);
    }

    /**
     * @param sentence sentence text
     * @return averaged distribution
     * @throws ClassifierException if any member fails or misbehaves
     */
    public EnsembleResult classify(String sentence) {
        Objects.requireNonNull(sentence, "sentence");
        List<ClassProbabilities> vectors = new ArrayList<>(members.size());
        for (SentenceClassifier member : members) {
            vectors.add(invoke(member, sentence));
        }
        ClassProbabilities average = ClassProbabilities.average(vectors);
        LOG.debug("Ensemble of {} averaged fact probability {}", members.size(), average.fact());
        return new EnsembleResult(average, members.size());
    }

    public int size() {
        return members.size();
    }

    public List<String> memberNames() {
        List<String> names = new ArrayList<>(members.size());
        for (SentenceClassifier m : members) {
            names.add(m.getName());
        }
        return List.copyOf(names);
    }

    private ClassProbabilities invoke(SentenceClassifier member, String sentence) {
        ClassProbabilities vector;
        try {
            vector = member.classify(sentence);
        } catch (ClassifierException ce) {
            throw ce;
        } catch (RuntimeException re) {
            throw new ClassifierException("Classifier failed: " + re.getMessage(), member.getName(), re);
        }
        if (vector == null) {
            throw new ClassifierException("Classifier returned no probabilities", member.getName());
        }
        if (!vector.isNormalized()) {
            throw new ClassifierException("Probabilities do not sum to 1 (" + vector.notFact()
                    + " + " + vector.fact() + ")", member.getName());
        }
        return vector;
    }
}

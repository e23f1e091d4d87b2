package com.phillippitts.factopinion.config;

import com.phillippitts.factopinion.service.annotate.AnnotatedWord;
import com.phillippitts.factopinion.service.annotate.DependencyAnnotator;
import com.phillippitts.factopinion.service.ensemble.ClassifierEnsemble;
import com.phillippitts.factopinion.testutil.FakeDependencyAnnotator;
import com.phillippitts.factopinion.testutil.FakeSentenceClassifier;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;

/**
 * Test configuration replacing the HTTP-backed annotator and classifier ensemble with in-memory
 * fakes, so the full Spring context can run without a UDPipe server or model servers.
 *
 * <p><b>Usage:</b>
 * <pre>
 * {@literal @}SpringBootTest
 * {@literal @}Import(IntegrationTestConfiguration.class)
 * class MyIntegrationTest { ... }
 * </pre>
 */
@TestConfiguration
public class IntegrationTestConfiguration {

    public static final String CITATION = "根据最新的数据，他们的市场份额正在扩大。";
    public static final String EVALUATION = "我觉得这个产品很棒。";

    @Bean
    @Primary
    public DependencyAnnotator testDependencyAnnotator() {
        return new FakeDependencyAnnotator()
                .with(CITATION,
                        AnnotatedWord.of("根据", "ADP", "case"),
                        AnnotatedWord.of("数据", "NOUN", "obl"),
                        AnnotatedWord.of("份额", "NOUN", "nsubj"),
                        AnnotatedWord.of("扩大", "VERB", "root"))
                .with(EVALUATION,
                        AnnotatedWord.of("产品", "NOUN", "nsubj"),
                        AnnotatedWord.of("很", "ADV", "advmod"),
                        AnnotatedWord.of("棒", "ADJ", "ccomp"));
    }

    @Bean
    @Primary
    public ClassifierEnsemble testClassifierEnsemble() {
        return new ClassifierEnsemble(List.of(
                new FakeSentenceClassifier("fake-1", 0.55),
                new FakeSentenceClassifier("fake-2", 0.45),
                new FakeSentenceClassifier("fake-3", 0.5)));
    }
}

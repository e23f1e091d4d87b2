package com.phillippitts.factopinion.config.ensemble;

import com.phillippitts.factopinion.config.properties.EnsembleProperties;
import com.phillippitts.factopinion.service.ensemble.ClassifierEnsemble;
import com.phillippitts.factopinion.service.ensemble.RemoteSentenceClassifier;
import com.phillippitts.factopinion.service.ensemble.SentenceClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds one {@link RemoteSentenceClassifier} per configured endpoint and groups them into the
 * {@link ClassifierEnsemble}. Members are named {@code classifier-1..N} in endpoint order.
 */
@Configuration
public class EnsembleConfig {

    private static final Logger LOG = LogManager.getLogger(EnsembleConfig.class);

    @Bean
    public ClassifierEnsemble classifierEnsemble(EnsembleProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getTimeoutMs());
        requestFactory.setReadTimeout(props.getTimeoutMs());
        RestClient restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();

        List<SentenceClassifier> members = new ArrayList<>(props.getEndpoints().size());
        int n = 1;
        for (URI endpoint : props.getEndpoints()) {
            members.add(new RemoteSentenceClassifier("classifier-" + n++, restClient, endpoint,
                    props.getFactLabel()));
        }
        ClassifierEnsemble ensemble = new ClassifierEnsemble(members);
        LOG.info("Classifier ensemble configured: members={}, factLabel={}",
                ensemble.memberNames(), props.getFactLabel());
        return ensemble;
    }
}

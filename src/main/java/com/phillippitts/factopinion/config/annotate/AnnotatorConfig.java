package com.phillippitts.factopinion.config.annotate;

import com.phillippitts.factopinion.config.properties.AnnotatorProperties;
import com.phillippitts.factopinion.service.annotate.DependencyAnnotator;
import com.phillippitts.factopinion.service.annotate.UdpipeDependencyAnnotator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the UDPipe REST annotator.
 */
@Configuration
public class AnnotatorConfig {

    private static final Logger LOG = LogManager.getLogger(AnnotatorConfig.class);

    @Bean
    public DependencyAnnotator dependencyAnnotator(AnnotatorProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getTimeoutMs());
        requestFactory.setReadTimeout(props.getTimeoutMs());

        RestClient restClient = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
        LOG.info("Dependency annotator: url={}, model={}, timeoutMs={}",
                props.getBaseUrl(), props.getModel(), props.getTimeoutMs());
        return new UdpipeDependencyAnnotator(restClient, props.getModel());
    }
}

package com.phillippitts.factopinion.service.ensemble;

import com.phillippitts.factopinion.exception.ClassifierException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.Objects;

/**
 * {@link SentenceClassifier} that calls a text-classification inference endpoint over HTTP.
 *
 * <p>Request body: {@code {"inputs": "<sentence>"}}. The response is decoded by
 * {@link ClassifierResponseParser}; {@code factLabel} names the label holding the fact class.
 *
 * <p>Thread-safe: stateless apart from the immutable client and configuration.
 */
public class RemoteSentenceClassifier implements SentenceClassifier {

    private static final Logger LOG = LogManager.getLogger(RemoteSentenceClassifier.class);

    private final String name;
    private final RestClient restClient;
    private final URI endpoint;
    private final String factLabel;

    /**
     * @param name       member name for logs and errors
     * @param restClient shared HTTP client
     * @param endpoint   inference endpoint of this member
     * @param factLabel  label of the fact class in the server's responses
     */
    public RemoteSentenceClassifier(String name, RestClient restClient, URI endpoint, String factLabel) {
        this.name = Objects.requireNonNull(name, "name");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.factLabel = Objects.requireNonNull(factLabel, "factLabel");
    }

    @Override
    public ClassProbabilities classify(String sentence) {
        Objects.requireNonNull(sentence, "sentence");
        String request = new JSONObject().put("inputs", sentence).toString();

        String body;
        long t0 = System.nanoTime();
        try {
            body = restClient.post()
                    .uri(endpoint)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            LOG.warn("{} inference request failed: {}", name, e.getMessage());
            throw new ClassifierException("Inference request failed: " + e.getMessage(), name, e);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000L;
        LOG.debug("{} answered in {} ms", name, ms);

        return ClassifierResponseParser.parse(body, factLabel, name);
    }

    @Override
    public String getName() {
        return name;
    }
}

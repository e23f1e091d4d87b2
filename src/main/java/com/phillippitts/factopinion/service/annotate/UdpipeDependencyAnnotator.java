package com.phillippitts.factopinion.service.annotate;

import com.phillippitts.factopinion.exception.AnnotationException;
import com.phillippitts.factopinion.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Objects;

/**
 * {@link DependencyAnnotator} backed by a UDPipe-compatible REST server.
 *
 * <p>Each call posts the sentence to {@code /process} with tokenizer, tagger and parser enabled
 * and parses the CoNLL-U document returned in the JSON {@code result} field.
 *
 * <p>Thread-safe: holds only an immutable {@link RestClient} and the model name.
 */
public class UdpipeDependencyAnnotator implements DependencyAnnotator {

    private static final Logger LOG = LogManager.getLogger(UdpipeDependencyAnnotator.class);
    private static final int LOG_PREVIEW_CHARS = 20;

    private final RestClient restClient;
    private final String model;

    /**
     * @param restClient client with the annotator base URL already applied
     * @param model      model name understood by the server (e.g. {@code chinese-gsd})
     */
    public UdpipeDependencyAnnotator(RestClient restClient, String model) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public List<AnnotatedWord> annotate(String sentence) {
        Objects.requireNonNull(sentence, "sentence");

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("model", model);
        form.add("tokenizer", "");
        form.add("tagger", "");
        form.add("parser", "");
        form.add("data", sentence);

        String body;
        try {
            body = restClient.post()
                    .uri("/process")
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            LOG.warn("Annotator call failed for sentence '{}': {}",
                    LogSanitizer.truncate(sentence, LOG_PREVIEW_CHARS), e.getMessage());
            throw new AnnotationException("Annotator request failed: " + e.getMessage(), e);
        }

        String conllu = extractResult(body);
        List<AnnotatedWord> words = ConlluParser.parse(conllu);
        LOG.debug("Annotated sentence into {} words", words.size());
        return words;
    }

    static String extractResult(String body) {
        if (body == null || body.isBlank()) {
            throw new AnnotationException("Annotator returned an empty response");
        }
        try {
            JSONObject obj = new JSONObject(body);
            if (!obj.has("result")) {
                throw new AnnotationException("Annotator response has no 'result' field");
            }
            return obj.getString("result");
        } catch (JSONException e) {
            throw new AnnotationException("Annotator response is not valid JSON", e);
        }
    }
}

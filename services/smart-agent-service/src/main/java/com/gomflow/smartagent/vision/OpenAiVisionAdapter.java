package com.gomflow.smartagent.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.exception.ExtractionUnavailableException;
import com.gomflow.smartagent.intake.PreparedImage;
import com.gomflow.smartagent.port.ResilientPortInvoker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured-extraction port backed by an OpenAI-compatible chat completions endpoint.
 * The normalised JPEG is inlined as a base64 data URL.
 */
@Slf4j
@Component
public class OpenAiVisionAdapter implements StructuredExtractionPort {

    static final String PORT_NAME = "extraction";

    private final RestTemplate restTemplate;
    private final ResilientPortInvoker invoker;
    private final VisionResponseParser responseParser;
    private final SmartAgentProperties.Vision settings;

    public OpenAiVisionAdapter(@Qualifier("visionRestTemplate") RestTemplate restTemplate,
                               ResilientPortInvoker invoker,
                               VisionResponseParser responseParser,
                               SmartAgentProperties properties) {
        this.restTemplate = restTemplate;
        this.invoker = invoker;
        this.responseParser = responseParser;
        this.settings = properties.getPorts().getVision();
    }

    @Override
    public VisionExtraction extractStructured(PreparedImage image, ExtractionTaskHint taskHint) {
        ExtractionTaskHint hint = taskHint != null ? taskHint : ExtractionTaskHint.paymentAnalysis();
        return invoker.invoke(PORT_NAME,
                settings.getRetry().toPolicy(),
                settings.getTimeout(),
                () -> analyze(image, hint),
                ExtractionUnavailableException::new);
    }

    private VisionExtraction analyze(PreparedImage image, ExtractionTaskHint hint) {
        long startTime = System.currentTimeMillis();

        ResponseEntity<JsonNode> response = restTemplate.exchange(
                settings.getUrl(),
                HttpMethod.POST,
                new HttpEntity<>(buildRequest(image, hint), headers()),
                JsonNode.class);

        JsonNode body = response.getBody();
        String content = body == null ? null
                : body.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null) {
            throw new IllegalStateException("No response from AI vision analysis");
        }

        VisionExtraction extraction = responseParser.parse(content, settings.getModel());
        log.info("AI vision analysis completed: task={}, confidence={}, fallbackParsed={}, tokens={}, took={}ms",
                hint.type(), extraction.confidence(), extraction.fallbackParsed(),
                body.path("usage").path("total_tokens").asInt(0), System.currentTimeMillis() - startTime);
        return extraction;
    }

    Map<String, Object> buildRequest(PreparedImage image, ExtractionTaskHint hint) {
        Map<String, Object> imageUrl = new HashMap<>();
        imageUrl.put("url", "data:image/jpeg;base64," + image.normalizedBase64());
        imageUrl.put("detail", "high");

        List<Map<String, Object>> content = List.of(
                Map.of("type", "text", "text", hint.prompt()),
                Map.of("type", "image_url", "image_url", imageUrl));

        Map<String, Object> request = new HashMap<>();
        request.put("model", settings.getModel());
        request.put("max_tokens", settings.getMaxTokens());
        request.put("temperature", 0.1);
        request.put("messages", List.of(Map.of("role", "user", "content", content)));
        return request;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        return headers;
    }
}

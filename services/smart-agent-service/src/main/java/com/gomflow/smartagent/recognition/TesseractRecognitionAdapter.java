package com.gomflow.smartagent.recognition;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.smartagent.config.SmartAgentProperties;
import com.gomflow.smartagent.exception.RecognitionUnavailableException;
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recognition port backed by an HTTP Tesseract server.
 *
 * Sparse-text page segmentation suits app screenshots. Words and blocks under the configured
 * confidence are dropped; the engine reports confidence on a 0-100 scale.
 */
@Slf4j
@Component
public class TesseractRecognitionAdapter implements RecognitionPort {

    static final String PORT_NAME = "recognition";

    private static final int PSM_SPARSE_TEXT = 11;
    private static final String CHAR_WHITELIST =
            "0123456789.,₱RM+-:()[]#ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz/ ";

    private final RestTemplate restTemplate;
    private final ResilientPortInvoker invoker;
    private final SmartAgentProperties.Recognition settings;

    public TesseractRecognitionAdapter(@Qualifier("ocrRestTemplate") RestTemplate restTemplate,
                                       ResilientPortInvoker invoker,
                                       SmartAgentProperties properties) {
        this.restTemplate = restTemplate;
        this.invoker = invoker;
        this.settings = properties.getPorts().getRecognition();
    }

    @Override
    public OcrResult extractText(PreparedImage image) {
        return invoker.invoke(PORT_NAME,
                settings.getRetry().toPolicy(),
                settings.getTimeout(),
                () -> recognize(image),
                RecognitionUnavailableException::new);
    }

    private OcrResult recognize(PreparedImage image) {
        long startTime = System.currentTimeMillis();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        Map<String, Object> options = new HashMap<>();
        options.put("languages", settings.getLanguages());
        options.put("pageSegmentationMode", PSM_SPARSE_TEXT);
        options.put("charWhitelist", CHAR_WHITELIST);
        options.put("preserveInterwordSpaces", true);

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("image", image.recognitionBase64());
        requestBody.put("options", options);

        ResponseEntity<JsonNode> response = restTemplate.exchange(
                settings.getUrl(),
                HttpMethod.POST,
                new HttpEntity<>(requestBody, headers),
                JsonNode.class);

        JsonNode body = response.getBody();
        if (body == null) {
            throw new IllegalStateException("OCR engine returned an empty body");
        }

        OcrResult result = toOcrResult(body);
        log.info("OCR extraction completed: confidence={}, words={}, blocks={}, textLength={}, took={}ms",
                result.confidence(), result.words().size(), result.blocks().size(),
                result.text().length(), System.currentTimeMillis() - startTime);
        return result;
    }

    OcrResult toOcrResult(JsonNode body) {
        double threshold = settings.getWordConfidenceThreshold();

        List<OcrResult.Word> words = new ArrayList<>();
        for (JsonNode word : body.path("words")) {
            double confidence = word.path("confidence").asDouble(0);
            if (confidence >= threshold) {
                words.add(new OcrResult.Word(word.path("text").asText(""), confidence / 100.0, box(word.path("bbox"))));
            }
        }

        List<OcrResult.Block> blocks = new ArrayList<>();
        for (JsonNode block : body.path("blocks")) {
            double confidence = block.path("confidence").asDouble(0);
            if (confidence >= threshold) {
                blocks.add(new OcrResult.Block(block.path("text").asText(""), confidence / 100.0, box(block.path("bbox"))));
            }
        }

        return new OcrResult(
                body.path("text").asText(""),
                body.path("confidence").asDouble(0) / 100.0,
                words,
                blocks,
                settings.getLanguages());
    }

    private static OcrResult.BoundingBox box(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        return new OcrResult.BoundingBox(
                node.path("x0").asInt(),
                node.path("y0").asInt(),
                node.path("x1").asInt(),
                node.path("y1").asInt());
    }
}

package com.noi.backend.services.extraction.engine;

import java.time.Duration;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.noi.backend.services.extraction.ExtractionTimeoutException;
import com.noi.backend.services.extraction.ModelCallException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.InternalServerException;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.RateLimitException;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link ModelClient} over the OpenAI Responses API. Without an API key the client reports itself
 * unavailable and the pipeline goes straight to pattern extraction.
 */
@Slf4j
@Component
public class OpenAiModelClient implements ModelClient {

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.max-tokens:2000}")
    private int maxTokens;

    @Value("${openai.timeout-seconds:60}")
    private int timeoutSeconds;

    private volatile OpenAIClient client;

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(String prompt, double temperature) {
        if (!isAvailable()) {
            throw new ModelCallException("OPENAI_API_KEY is not configured");
        }
        OpenAIClient c = getOrCreateClient(apiKey.trim());

        ResponseCreateParams params = ResponseCreateParams.builder()
                .model(model)
                .input(prompt)
                .maxOutputTokens(maxTokens)
                .temperature(temperature)
                .build();

        long start = System.currentTimeMillis();
        try {
            Response response = c.responses().create(params);
            String output = extractOutputText(response);
            log.debug("[OpenAI] Response received (chars={} elapsedMs={})", output.length(), System.currentTimeMillis() - start);
            return output;
        } catch (RateLimitException e) {
            throw new ExtractionTimeoutException("Rate limited by model provider", e);
        } catch (InternalServerException | OpenAIIoException e) {
            throw new ExtractionTimeoutException("Model provider unreachable: " + e.getMessage(), e);
        } catch (OpenAIException e) {
            throw new ModelCallException("Model call failed: " + e.getMessage(), e);
        }
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .timeout(Duration.ofSeconds(Math.max(1, timeoutSeconds)))
                    // Retries and backoff are owned by ExtractionEngine.
                    .maxRetries(0)
                    .build();
            return client;
        }
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (sb.length() > 0) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }
}

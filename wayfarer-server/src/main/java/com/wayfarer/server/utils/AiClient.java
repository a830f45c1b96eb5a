package com.wayfarer.server.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.properties.AiProperties;
import com.wayfarer.server.metrics.MetricsRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 推理服务客户端，调用 OpenAI 兼容的 Chat Completion 接口。
 * Reasoning service client for an OpenAI-compatible chat completion API.
 *
 * 约定：
 * - 只返回纯文本，结构化解析交给 {@link LlmJsonParser}；
 * - 429 按 base * 2^(n-1) 退避后重试，5xx / 超时直接重试，其他错误视为本次调用永久失败；
 * - 任何失败都返回 null，由上层自行降级。
 */
@Component
@Slf4j
public class AiClient {

    private final AiProperties aiProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient aiHttpClient;
    private final MetricsRecorder metricsRecorder;

    public AiClient(AiProperties aiProperties,
                    ObjectMapper objectMapper,
                    @Qualifier("aiHttpClient") HttpClient aiHttpClient,
                    MetricsRecorder metricsRecorder) {
        this.aiProperties = aiProperties;
        this.objectMapper = objectMapper;
        this.aiHttpClient = aiHttpClient;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * 带结构化上下文的调用：上下文序列化为 JSON 后以 "CONTEXT:" 段追加到 user prompt 末尾。
     * Context is appended to the user prompt as a JSON block.
     */
    public String chat(String systemPrompt, String userPrompt, Object context) {
        if (context == null) {
            return chat(systemPrompt, userPrompt);
        }
        String contextJson;
        try {
            contextJson = objectMapper.writeValueAsString(context);
        } catch (Exception e) {
            log.warn("序列化 LLM 上下文失败，按无上下文调用: {}", e.getMessage());
            return chat(systemPrompt, userPrompt);
        }
        return chat(systemPrompt, userPrompt + "\nCONTEXT:\n" + contextJson);
    }

    /**
     * 调用外部 AI 服务，传入 system + user prompt，返回纯文本回复内容。
     * 若配置不完整或调用失败，返回 null。
     */
    public String chat(String systemPrompt, String userPrompt) {
        String model = aiProperties.getModel();
        if (!StringUtils.hasText(aiProperties.getBaseUrl())
                || !StringUtils.hasText(aiProperties.getApiKey())
                || !StringUtils.hasText(model)) {
            log.warn("AI 配置不完整，跳过外部 LLM 调用");
            metricsRecorder.recordAiChatCall("skipped", "config_missing", model);
            return null;
        }

        long startNs = System.nanoTime();
        int promptBytes = safeBytes(systemPrompt) + safeBytes(userPrompt);
        int attempts = 0;
        int rateLimitHits = 0;
        try {
            int maxRetries = Math.max(0, aiProperties.getMaxRetries());
            int maxAttempts = 1 + maxRetries;
            for (int i = 1; i <= maxAttempts; i++) {
                attempts = i;
                AiHttpResult r = doHttpCall(systemPrompt, userPrompt);
                if (r.success) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "success", model);
                    metricsRecorder.recordAiChatCall("success", "ok", model);
                    log.info("AI chat success: model={}, latencyMs={}, attempts={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, promptBytes, r.responseBytes);
                    return r.content;
                }

                boolean retriable = isRetriable(r.statusCode, r.errorType);
                if (!retriable || i == maxAttempts) {
                    long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
                    metricsRecorder.recordAiChatLatencyMs(latencyMs, "fail", model);
                    metricsRecorder.recordAiChatCall("fail", r.errorType, model);
                    log.warn("AI chat fail: model={}, latencyMs={}, attempts={}, statusCode={}, errorType={}, promptBytes={}, respBytes={}",
                            model, latencyMs, attempts, r.statusCode, r.errorType, promptBytes, r.responseBytes);
                    return null;
                }
                if (r.statusCode == 429) {
                    rateLimitHits++;
                    long backoffMs = backoffMillis(rateLimitHits);
                    log.warn("AI 服务限流，{}ms 后重试: model={}, attempt={}/{}", backoffMs, model, i, maxAttempts);
                    if (!sleep(backoffMs)) {
                        metricsRecorder.recordAiChatCall("fail", "interrupted", model);
                        return null;
                    }
                }
            }
            return null;
        } catch (Exception e) {
            metricsRecorder.recordAiChatCall("fail", "exception", model);
            log.error("调用外部 LLM 失败", e);
            return null;
        }
    }

    /**
     * 第 n 次限流后的等待时长：base * 2^(n-1)。
     */
    long backoffMillis(int rateLimitHits) {
        long base = Math.max(0L, aiProperties.getRateLimitBackoffMs());
        int shift = Math.min(Math.max(0, rateLimitHits - 1), 10);
        return base * (1L << shift);
    }

    /**
     * @return false 表示等待期间线程被中断，调用方应放弃重试
     */
    protected boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("AI 限流退避等待被中断");
            return false;
        }
    }

    private AiHttpResult doHttpCall(String systemPrompt, String userPrompt) {
        try {
            Map<String, Object> body = new HashMap<>();
            body.put("model", aiProperties.getModel());

            Map<String, String> sysMsg = new HashMap<>();
            sysMsg.put("role", "system");
            sysMsg.put("content", systemPrompt);

            Map<String, String> userMsg = new HashMap<>();
            userMsg.put("role", "user");
            userMsg.put("content", userPrompt);

            body.put("messages", List.of(sysMsg, userMsg));
            String json = objectMapper.writeValueAsString(body);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(aiProperties.getBaseUrl()))
                    .timeout(Duration.ofMillis(Math.max(1, aiProperties.getRequestTimeoutMs())))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + aiProperties.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();

            HttpResponse<String> response = aiHttpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int code = response.statusCode();
            String respBody = response.body();
            int respBytes = safeBytes(respBody);

            if (code / 100 != 2 || !StringUtils.hasText(respBody)) {
                return AiHttpResult.fail(code, "http_" + code, respBytes);
            }

            JsonNode root = objectMapper.readTree(respBody);
            JsonNode choices = root.get("choices");
            if (choices == null || !choices.isArray() || choices.isEmpty()) {
                return AiHttpResult.fail(code, "bad_response_no_choices", respBytes);
            }
            JsonNode message = choices.get(0).get("message");
            if (message == null) {
                return AiHttpResult.fail(code, "bad_response_no_message", respBytes);
            }
            JsonNode content = message.get("content");
            if (content == null || !StringUtils.hasText(content.asText())) {
                return AiHttpResult.fail(code, "bad_response_empty_content", respBytes);
            }
            return AiHttpResult.ok(content.asText().trim(), respBytes);
        } catch (java.net.http.HttpTimeoutException te) {
            return AiHttpResult.fail(0, "timeout", 0);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return AiHttpResult.fail(0, "interrupted", 0);
        } catch (Exception e) {
            log.debug("AI HTTP 调用异常: {}", e.getMessage());
            return AiHttpResult.fail(0, "exception", 0);
        }
    }

    private boolean isRetriable(int statusCode, String errorType) {
        if ("timeout".equals(errorType)) {
            return true;
        }
        if (statusCode == 429) {
            return true;
        }
        return statusCode / 100 == 5;
    }

    private int safeBytes(String s) {
        if (!StringUtils.hasText(s)) {
            return 0;
        }
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static class AiHttpResult {
        private final boolean success;
        private final String content;
        private final int statusCode;
        private final String errorType;
        private final int responseBytes;

        private AiHttpResult(boolean success, String content, int statusCode, String errorType, int responseBytes) {
            this.success = success;
            this.content = content;
            this.statusCode = statusCode;
            this.errorType = errorType;
            this.responseBytes = responseBytes;
        }

        static AiHttpResult ok(String content, int responseBytes) {
            return new AiHttpResult(true, content, 200, "ok", responseBytes);
        }

        static AiHttpResult fail(int statusCode, String errorType, int responseBytes) {
            return new AiHttpResult(false, null, statusCode, errorType, responseBytes);
        }
    }
}

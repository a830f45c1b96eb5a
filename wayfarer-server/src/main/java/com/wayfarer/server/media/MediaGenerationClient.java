package com.wayfarer.server.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wayfarer.common.exception.MediaGenerationException;
import com.wayfarer.common.properties.MediaProperties;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 海报 / 视频生成服务客户端。
 *
 * - 海报：POST {baseUrl}/images/generations，同步返回 data[0].url；
 * - 视频：POST {baseUrl}/videos 创建任务，再按 pollIntervalMs 轮询 GET {baseUrl}/videos/{id}，
 *   超过 maxPollSeconds 仍未完成即抛 {@link MediaGenerationException}；
 * - 未配置地址 / 密钥 / 模型时返回 null，表示跳过该产物。
 */
@Component
@Slf4j
public class MediaGenerationClient {

    private final MediaProperties mediaProperties;
    private final ObjectMapper objectMapper;
    private final HttpClient mediaHttpClient;

    public MediaGenerationClient(MediaProperties mediaProperties,
                                 ObjectMapper objectMapper,
                                 @Qualifier("mediaHttpClient") HttpClient mediaHttpClient) {
        this.mediaProperties = mediaProperties;
        this.objectMapper = objectMapper;
        this.mediaHttpClient = mediaHttpClient;
    }

    public String generatePoster(String prompt) {
        String model = mediaProperties.getImageModel();
        if (!configured(model)) {
            log.warn("海报生成未配置，跳过");
            return null;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("n", 1);
        JsonNode root = post("/images/generations", body);
        String url = root.path("data").path(0).path("url").asText(null);
        if (!StringUtils.hasText(url)) {
            throw new MediaGenerationException("海报生成结果缺少 url");
        }
        return url;
    }

    public String generateVideo(String prompt, String posterUrl) {
        String model = mediaProperties.getVideoModel();
        if (!configured(model)) {
            log.warn("视频生成未配置，跳过");
            return null;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        if (StringUtils.hasText(posterUrl)) {
            body.put("image_url", posterUrl);
        }
        JsonNode created = post("/videos", body);
        String jobId = created.path("id").asText(null);
        if (!StringUtils.hasText(jobId)) {
            throw new MediaGenerationException("视频任务创建结果缺少 id");
        }
        return pollVideo(jobId);
    }

    private String pollVideo(String jobId) {
        long maxPollNanos = Duration.ofSeconds(Math.max(0L, mediaProperties.getMaxPollSeconds())).toNanos();
        long start = System.nanoTime();
        int polls = 0;
        while (true) {
            polls++;
            JsonNode job = get("/videos/" + jobId);
            String status = job.path("status").asText("");
            switch (status) {
                case "completed", "succeeded" -> {
                    String url = job.path("url").asText(null);
                    if (!StringUtils.hasText(url)) {
                        url = trimBaseUrl() + "/videos/" + jobId + "/content";
                    }
                    log.info("视频生成完成: jobId={}, polls={}", jobId, polls);
                    return url;
                }
                case "failed", "cancelled" -> throw new MediaGenerationException(
                        "视频生成失败: " + job.path("error").path("message").asText(status));
                default -> {
                    // queued / in_progress
                }
            }
            if (System.nanoTime() - start >= maxPollNanos) {
                throw new MediaGenerationException("视频生成超时: jobId=" + jobId + ", polls=" + polls);
            }
            if (!sleep(mediaProperties.getPollIntervalMs())) {
                throw new MediaGenerationException("视频轮询被中断: jobId=" + jobId);
            }
        }
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            HttpRequest request = baseRequest(path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(
                            objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
            return send(request);
        } catch (MediaGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new MediaGenerationException("媒体生成请求失败: " + path, e);
        }
    }

    private JsonNode get(String path) {
        return send(baseRequest(path).GET().build());
    }

    private JsonNode send(HttpRequest request) {
        try {
            HttpResponse<String> response = mediaHttpClient.send(
                    request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new MediaGenerationException("媒体生成服务返回非 2xx: status=" + response.statusCode()
                        + ", uri=" + request.uri().getPath());
            }
            return objectMapper.readTree(response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaGenerationException("媒体生成请求被中断", e);
        } catch (MediaGenerationException e) {
            throw e;
        } catch (Exception e) {
            throw new MediaGenerationException("媒体生成请求失败: " + request.uri().getPath(), e);
        }
    }

    private HttpRequest.Builder baseRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(trimBaseUrl() + path))
                .timeout(Duration.ofMillis(mediaProperties.getRequestTimeoutMs()))
                .header("Authorization", "Bearer " + mediaProperties.getApiKey());
    }

    private String trimBaseUrl() {
        String baseUrl = mediaProperties.getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private boolean configured(String model) {
        return StringUtils.hasText(mediaProperties.getBaseUrl())
                && StringUtils.hasText(mediaProperties.getApiKey())
                && StringUtils.hasText(model);
    }

    /**
     * @return false 表示等待期间被中断
     */
    protected boolean sleep(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

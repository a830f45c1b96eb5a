package com.wayfarer.server.config;

import com.wayfarer.common.properties.AiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 外部 HTTP 客户端配置：
 * - 使用 JDK 17 自带 HttpClient（连接复用 + 低依赖）
 * - aiHttpClient 供推理服务使用，mediaHttpClient 供海报 / 视频生成使用，两者连接池互不影响
 */
@Configuration
@RequiredArgsConstructor
public class AiHttpClientConfig {

    private final AiProperties aiProperties;

    @Bean
    public HttpClient aiHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(aiProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public HttpClient mediaHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(aiProperties.getConnectTimeoutMs()))
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}

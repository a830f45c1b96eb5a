package com.wayfarer.server.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

/**
 * SpringDoc OpenAPI 文档配置，提供 /v3/api-docs 与 /swagger-ui.html。
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI wayfarerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Wayfarer 后端接口文档")
                        .description("对话式行程规划：画像抽取、并行调研、行程合成与海报/视频异步生成")
                        .version("v1"))
                .servers(Collections.singletonList(
                        new Server().url("/").description("默认服务端")
                ));
    }
}

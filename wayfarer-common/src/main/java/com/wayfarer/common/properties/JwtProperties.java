package com.wayfarer.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 可选的用户 token 校验配置。token 由账号系统签发，本服务只做验签。
 */
@Data
@ConfigurationProperties(prefix = "wayfarer.jwt")
public class JwtProperties {

    /** 与账号系统共享的 HS256 秘钥 */
    private String userSecretKey;

    /** 携带 token 的请求头名称 */
    private String userTokenName = "authentication";
}

package com.wayfarer.common.utils;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;

import java.util.Date;

/**
 * 用户 token 工具（HS256）。
 * 本服务只校验 token，签发由账号系统负责；issueUserToken 供联调和测试使用。
 */
public class JwtUtil {

    public static final String CLAIM_USER_ID = "userId";

    private JwtUtil() {
    }

    public static String issueUserToken(String secretKey, long ttlMillis, Long userId) {
        long nowMillis = System.currentTimeMillis();
        return Jwts.builder()
                .claim(CLAIM_USER_ID, userId)
                .setIssuedAt(new Date(nowMillis))
                .setExpiration(new Date(nowMillis + ttlMillis))
                .signWith(SignatureAlgorithm.HS256, secretKey)
                .compact();
    }

    /**
     * @return token 中的用户 ID；token 合法但没有 userId 声明时返回 null
     * @throws io.jsonwebtoken.JwtException 签名不合法或已过期
     */
    public static Long parseUserId(String secretKey, String token) {
        Claims claims = Jwts.parser()
                .setSigningKey(secretKey)
                .parseClaimsJws(token)
                .getBody();
        Object id = claims.get(CLAIM_USER_ID);
        return id == null ? null : Long.valueOf(id.toString());
    }
}

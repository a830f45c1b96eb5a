package com.wayfarer.common.context;

/**
 * 当前请求的调用方身份（基于 ThreadLocal）。
 * 只有携带合法 token 的请求会写入用户 ID，游客读取时返回 null。
 */
public class BaseContext {

    private static final ThreadLocal<Long> CURRENT_ID = new ThreadLocal<>();

    private BaseContext() {
    }

    public static void setCurrentId(Long id) {
        CURRENT_ID.set(id);
    }

    public static Long getCurrentId() {
        return CURRENT_ID.get();
    }

    public static boolean isGuest() {
        return CURRENT_ID.get() == null;
    }

    /**
     * 限流 / 日志用的调用方标识：登录用户为 u:{id}，游客为 ip:{clientIp}。
     */
    public static String callerKey(String clientIp) {
        Long id = CURRENT_ID.get();
        if (id != null) {
            return "u:" + id;
        }
        return "ip:" + (clientIp == null || clientIp.isBlank() ? "unknown" : clientIp);
    }

    public static void clear() {
        CURRENT_ID.remove();
    }
}

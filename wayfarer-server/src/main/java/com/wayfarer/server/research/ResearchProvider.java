package com.wayfarer.server.research;

/**
 * 调研源。各实现互相独立，由 {@link ResearchFanOut} 并行调用。
 * 实现可以抛出任意运行时异常，扇出层负责把异常转换为空结果。
 */
public interface ResearchProvider {

    /**
     * 调研源名称，同时作为 {@link ResearchContext} 中的 key。
     */
    String name();

    ProviderResult research(ResearchQuery query);
}

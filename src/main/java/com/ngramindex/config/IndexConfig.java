package com.ngramindex.config;

import com.ngramindex.text.Attribute;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * 索引运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class IndexConfig {
    private Path basePath = Paths.get("./index/corpus");
    private List<Attribute> attributes = List.copyOf(Arrays.asList(Attribute.values()));
    private int buildThreads = Constants.DEFAULT_BUILD_THREADS;

    public Path getBasePath() {
        return basePath;
    }

    public void setBasePath(Path basePath) {
        this.basePath = basePath;
    }

    public List<Attribute> getAttributes() {
        return attributes;
    }

    /**
     * 设置参与索引的简单属性，第一个属性作为句子重建的引导属性。
     */
    public void setAttributes(List<Attribute> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            throw new IllegalArgumentException("属性列表不能为空");
        }
        if (attributes.stream().distinct().count() != attributes.size()) {
            throw new IllegalArgumentException("属性列表包含重复项: " + attributes);
        }
        this.attributes = List.copyOf(attributes);
    }

    public int getBuildThreads() {
        return buildThreads;
    }

    public void setBuildThreads(int buildThreads) {
        this.buildThreads = buildThreads;
    }

    /**
     * 返回限制在 [1, MAX_BUILD_THREADS] 内的有效线程数。
     */
    public int effectiveBuildThreads() {
        if (buildThreads <= 0) {
            return Math.max(1, Math.min(Constants.DEFAULT_BUILD_THREADS, Constants.MAX_BUILD_THREADS));
        }
        return Math.min(buildThreads, Constants.MAX_BUILD_THREADS);
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }
}

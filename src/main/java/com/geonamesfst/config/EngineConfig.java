package com.geonamesfst.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private List<Path> geonamesPaths = new ArrayList<>();
    private List<Path> alternatePaths = new ArrayList<>();
    /** 为 null 时接受所有语言 */
    private Set<String> languages;
    private int defaultMaxDistance = Constants.DEFAULT_MAX_DISTANCE;
    private int defaultStateLimit = Constants.DEFAULT_STATE_LIMIT;

    public List<Path> getGeonamesPaths() {
        return geonamesPaths;
    }

    public void setGeonamesPaths(List<Path> geonamesPaths) {
        this.geonamesPaths = geonamesPaths == null ? new ArrayList<>() : new ArrayList<>(geonamesPaths);
    }

    public List<Path> getAlternatePaths() {
        return alternatePaths;
    }

    public void setAlternatePaths(List<Path> alternatePaths) {
        this.alternatePaths = alternatePaths == null ? new ArrayList<>() : new ArrayList<>(alternatePaths);
    }

    public Set<String> getLanguages() {
        return languages;
    }

    public void setLanguages(Set<String> languages) {
        this.languages = languages == null ? null : Set.copyOf(languages);
    }

    public int getDefaultMaxDistance() {
        return defaultMaxDistance;
    }

    public void setDefaultMaxDistance(int defaultMaxDistance) {
        this.defaultMaxDistance = defaultMaxDistance;
    }

    public int getDefaultStateLimit() {
        return defaultStateLimit;
    }

    public void setDefaultStateLimit(int defaultStateLimit) {
        this.defaultStateLimit = defaultStateLimit;
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}

package com.timxs.photowatermark.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timxs.photowatermark.config.StudioConfig;
import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * 配置管理器接口
 * 读取 JSON 配置文件，并负责配置对象与模板键值之间的转换
 */
public interface SettingsManager {

    /**
     * 获取配置
     * 依次尝试外部配置文件、类路径默认配置，读取失败时使用内置默认值
     *
     * @param settingsFile 外部配置文件（可为 null）
     * @return 配置对象
     */
    Mono<StudioConfig> getConfig(Path settingsFile);

    /**
     * 将键值配置应用到配置对象上，缺失或无效的项保持原值
     *
     * @param target 配置对象（会被修改）
     * @param bag    键值配置
     */
    void applyBag(StudioConfig target, JsonNode bag);

    /**
     * 导出水印和导出设置为模板键值
     *
     * @param config 配置对象
     * @return 键值配置
     */
    ObjectNode toBag(StudioConfig config);
}

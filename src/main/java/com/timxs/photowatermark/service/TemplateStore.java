package com.timxs.photowatermark.service;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * 命名模板存储
 * 模板内容是不带版本的键值配置，由 {@link SettingsManager} 负责与配置对象互相转换
 */
public interface TemplateStore {

    /**
     * 读取模板
     *
     * @param name 模板名称
     * @return 模板内容的副本，不存在时为空
     */
    Optional<ObjectNode> get(String name);

    /**
     * 保存模板，同名模板会被覆盖
     *
     * @param name 模板名称
     * @param bag  模板内容
     */
    void put(String name, ObjectNode bag);

    /**
     * 删除模板
     *
     * @param name 模板名称
     * @return 模板是否存在
     */
    boolean delete(String name);

    /**
     * 所有模板名称（按保存顺序）
     */
    List<String> list();
}

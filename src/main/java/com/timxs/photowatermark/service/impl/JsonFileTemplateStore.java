package com.timxs.photowatermark.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timxs.photowatermark.service.TemplateStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 JSON 文件的模板存储
 * 所有模板保存在同一个 JSON 对象中，键为模板名称
 */
@Slf4j
public class JsonFileTemplateStore implements TemplateStore {

    private final ObjectMapper objectMapper;

    private final Path file;

    /**
     * 内存中的模板，保持保存顺序
     */
    private final Map<String, ObjectNode> templates = new LinkedHashMap<>();

    public JsonFileTemplateStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
        load();
    }

    @Override
    public synchronized Optional<ObjectNode> get(String name) {
        ObjectNode bag = templates.get(key(name));
        return bag == null ? Optional.empty() : Optional.of(bag.deepCopy());
    }

    @Override
    public synchronized void put(String name, ObjectNode bag) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be blank");
        }
        if (bag == null) {
            throw new IllegalArgumentException("Template content cannot be null");
        }
        Map<String, ObjectNode> previous = new LinkedHashMap<>(templates);
        templates.put(key(name), bag.deepCopy());
        saveOrRestore(previous);
        log.info("模板已保存: {}", key(name));
    }

    @Override
    public synchronized boolean delete(String name) {
        Map<String, ObjectNode> previous = new LinkedHashMap<>(templates);
        if (templates.remove(key(name)) == null) {
            return false;
        }
        saveOrRestore(previous);
        log.info("模板已删除: {}", key(name));
        return true;
    }

    @Override
    public synchronized List<String> list() {
        return List.copyOf(templates.keySet());
    }

    private void load() {
        if (!Files.isRegularFile(file)) {
            log.debug("模板文件不存在，从空模板开始: {}", file);
            return;
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("模板文件格式无效，已忽略: {}", file);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (entry.getValue().isObject()) {
                    templates.put(entry.getKey(), (ObjectNode) entry.getValue());
                }
            }
            log.debug("已加载 {} 个模板: {}", templates.size(), file);
        } catch (IOException e) {
            log.warn("Failed to load templates from {}: {}", file, e.getMessage());
            templates.clear();
        }
    }

    /**
     * 模板名称忽略首尾空白
     */
    private static String key(String name) {
        return name == null ? null : name.trim();
    }

    /**
     * 写入文件，失败时恢复内存中的模板
     */
    private void saveOrRestore(Map<String, ObjectNode> previous) {
        try {
            save();
        } catch (UncheckedIOException e) {
            templates.clear();
            templates.putAll(previous);
            throw e;
        }
    }

    private void save() {
        ObjectNode root = objectMapper.createObjectNode();
        templates.forEach(root::set);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // UTF-8 输出，中文保持原样
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save templates to " + file, e);
        }
    }
}

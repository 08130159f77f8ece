package com.timxs.photowatermark.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timxs.photowatermark.config.ExportConfig;
import com.timxs.photowatermark.config.StudioConfig;
import com.timxs.photowatermark.config.WatermarkConfig;
import com.timxs.photowatermark.model.NamingRule;
import com.timxs.photowatermark.model.OutputFormat;
import com.timxs.photowatermark.model.WatermarkPosition;
import com.timxs.photowatermark.model.WatermarkType;
import com.timxs.photowatermark.service.SettingsManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 配置管理器实现
 * 从 JSON 配置文件中读取设置，转换为 StudioConfig 对象
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsManagerImpl implements SettingsManager {

    /**
     * 类路径上的默认配置
     */
    static final String DEFAULT_SETTINGS_RESOURCE = "photo-watermark.json";

    private final ObjectMapper objectMapper;

    /**
     * 获取配置
     * 先应用类路径默认配置，再应用外部配置文件
     *
     * @param settingsFile 外部配置文件（可为 null）
     * @return 完整的配置
     */
    @Override
    public Mono<StudioConfig> getConfig(Path settingsFile) {
        return Mono.fromCallable(() -> {
                StudioConfig config = new StudioConfig();
                applyDefaults(config);
                if (settingsFile != null) {
                    if (Files.isRegularFile(settingsFile)) {
                        applyBag(config, objectMapper.readTree(settingsFile.toFile()));
                        log.info("已加载配置文件: {}", settingsFile);
                    } else {
                        log.warn("配置文件不存在，使用默认配置: {}", settingsFile);
                    }
                }
                return config;
            })
            .onErrorResume(e -> {
                log.warn("Failed to load settings, using defaults: {}", e.getMessage());
                return Mono.just(new StudioConfig());
            });
    }

    private void applyDefaults(StudioConfig config) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_SETTINGS_RESOURCE)) {
            if (in == null) {
                log.debug("类路径上没有 {}，使用内置默认值", DEFAULT_SETTINGS_RESOURCE);
                return;
            }
            applyBag(config, objectMapper.readTree(in));
        }
    }

    /**
     * 应用键值配置
     * 支持 watermark、export、layout 三组设置以及 fontDirectories、templateFile
     *
     * @param target 配置对象（会被修改）
     * @param bag    键值配置
     */
    @Override
    public void applyBag(StudioConfig target, JsonNode bag) {
        if (bag == null || !bag.isObject()) {
            log.warn("配置内容不是 JSON 对象，已忽略");
            return;
        }

        JsonNode watermarkNode = bag.get("watermark");
        if (watermarkNode != null && watermarkNode.isObject()) {
            applyWatermark(target.getWatermark(), watermarkNode);
        }

        JsonNode exportNode = bag.get("export");
        if (exportNode != null && exportNode.isObject()) {
            applyExport(target.getExport(), exportNode);
        }

        JsonNode layout = bag.get("layout");
        if (layout != null && layout.isObject()) {
            target.setMargin(Math.max(0, getInt(layout, "margin", target.getMargin())));
            target.setPreviewWidth(getInt(layout, "previewWidth", target.getPreviewWidth()));
            target.setPreviewHeight(getInt(layout, "previewHeight", target.getPreviewHeight()));
        }

        List<String> fontDirectories = getStringList(bag, "fontDirectories");
        if (fontDirectories != null) {
            target.setFontDirectories(fontDirectories);
        }
        target.setTemplateFile(getString(bag, "templateFile", target.getTemplateFile()));
    }

    private void applyWatermark(WatermarkConfig watermark, JsonNode node) {
        if (node.has("type")) {
            watermark.setType(WatermarkType.fromName(getString(node, "type", watermark.getType().name())));
        }

        // 文字水印
        watermark.setText(getString(node, "text", watermark.getText()));
        watermark.setFontFamily(getString(node, "fontFamily", watermark.getFontFamily()));
        watermark.setFontSize(getInt(node, "fontSize", watermark.getFontSize()));
        watermark.setBold(getBoolean(node, "bold", watermark.isBold()));
        watermark.setItalic(getBoolean(node, "italic", watermark.isItalic()));
        watermark.setShadow(getBoolean(node, "shadow", watermark.isShadow()));
        watermark.setColor(getString(node, "color", watermark.getColor()));
        watermark.setColorAlpha(getInt(node, "colorAlpha", watermark.getColorAlpha()));
        watermark.setOpacity(getInt(node, "opacity", watermark.getOpacity()));
        if (node.has("resolvedFontPath")) {
            watermark.setResolvedFontPath(getString(node, "resolvedFontPath", null));
        }

        // 图片水印
        watermark.setImagePath(getString(node, "imagePath", watermark.getImagePath()));
        watermark.setImageOpacity(getInt(node, "imageOpacity", watermark.getImageOpacity()));
        if (node.has("imageScale")) {
            watermark.setImageScale(getInteger(node, "imageScale"));
        }

        // 位置和旋转
        if (node.has("position")) {
            String posStr = getString(node, "position", watermark.getPosition().getKey());
            watermark.setPosition(WatermarkPosition.fromKey(posStr));
        }
        if (node.has("customX") || node.has("customY")) {
            watermark.setCustomX(getInteger(node, "customX"));
            watermark.setCustomY(getInteger(node, "customY"));
        }
        watermark.setRotation(getDouble(node, "rotation", watermark.getRotation()));

        log.debug("读取水印配置 - type: {}, text: '{}', position: {}, custom: ({}, {})",
            watermark.getType(), watermark.getText(), watermark.getPosition(),
            watermark.getCustomX(), watermark.getCustomY());
    }

    private void applyExport(ExportConfig export, JsonNode node) {
        if (node.has("format")) {
            export.setFormat(OutputFormat.fromName(getString(node, "format", export.getFormat().name())));
        }
        export.setQuality(getInt(node, "quality", export.getQuality()));
        if (node.has("namingRule")) {
            export.setNamingRule(NamingRule.fromKey(getString(node, "namingRule", export.getNamingRule().getKey())));
        }
        export.setPrefix(getString(node, "prefix", export.getPrefix()));
        export.setSuffix(getString(node, "suffix", export.getSuffix()));
    }

    /**
     * 导出水印和导出设置
     * 生成的键值可以直接通过 {@link #applyBag} 应用回去
     */
    @Override
    public ObjectNode toBag(StudioConfig config) {
        ObjectNode bag = objectMapper.createObjectNode();

        WatermarkConfig watermark = config.getWatermark();
        ObjectNode watermarkNode = bag.putObject("watermark");
        watermarkNode.put("type", watermark.getType().name().toLowerCase());
        watermarkNode.put("text", watermark.getText());
        watermarkNode.put("fontFamily", watermark.getFontFamily());
        watermarkNode.put("fontSize", watermark.getFontSize());
        watermarkNode.put("bold", watermark.isBold());
        watermarkNode.put("italic", watermark.isItalic());
        watermarkNode.put("shadow", watermark.isShadow());
        watermarkNode.put("color", watermark.getColor());
        watermarkNode.put("colorAlpha", watermark.getColorAlpha());
        watermarkNode.put("opacity", watermark.getOpacity());
        watermarkNode.put("resolvedFontPath", watermark.getResolvedFontPath());
        watermarkNode.put("imagePath", watermark.getImagePath());
        watermarkNode.put("imageOpacity", watermark.getImageOpacity());
        watermarkNode.put("imageScale", watermark.getImageScale());
        watermarkNode.put("position", watermark.getPosition().getKey());
        watermarkNode.put("customX", watermark.getCustomX());
        watermarkNode.put("customY", watermark.getCustomY());
        watermarkNode.put("rotation", watermark.getRotation());

        ExportConfig export = config.getExport();
        ObjectNode exportNode = bag.putObject("export");
        exportNode.put("format", export.getFormat().getFormatName());
        exportNode.put("quality", export.getQuality());
        exportNode.put("namingRule", export.getNamingRule().getKey());
        exportNode.put("prefix", export.getPrefix());
        exportNode.put("suffix", export.getSuffix());

        return bag;
    }

    // ========== JsonNode 辅助方法 ==========

    /**
     * 从 JsonNode 获取布尔值
     */
    private boolean getBoolean(JsonNode node, String key, boolean defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isBoolean()) {
            return value.asBoolean();
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取整数值
     * 支持数字类型和字符串类型
     */
    private int getInt(JsonNode node, String key, int defaultValue) {
        Integer value = getInteger(node, key);
        return value != null ? value : defaultValue;
    }

    /**
     * 从 JsonNode 获取可为空的整数值
     * 值为 null 或无法解析时返回 null
     */
    private Integer getInteger(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asInt();
            }
            if (value.isTextual()) {
                try {
                    return Integer.parseInt(value.asText().trim());
                } catch (NumberFormatException e) {
                    log.warn("配置项 {} 不是有效的整数: {}", key, value.asText());
                    return null;
                }
            }
        }
        return null;
    }

    /**
     * 从 JsonNode 获取双精度浮点值
     * 支持数字类型和字符串类型
     */
    private double getDouble(JsonNode node, String key, double defaultValue) {
        JsonNode value = node.get(key);
        if (value != null) {
            if (value.isNumber()) {
                return value.asDouble();
            }
            if (value.isTextual()) {
                try {
                    return Double.parseDouble(value.asText().trim());
                } catch (NumberFormatException e) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串值
     */
    private String getString(JsonNode node, String key, String defaultValue) {
        JsonNode value = node.get(key);
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        return defaultValue;
    }

    /**
     * 从 JsonNode 获取字符串列表
     * 支持数组类型和逗号分隔的字符串类型
     *
     * @return 字符串列表，如果键不存在则返回 null
     */
    private List<String> getStringList(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null) {
            return null;
        }
        List<String> list = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    list.add(item.asText().trim());
                }
            });
        } else if (value.isTextual()) {
            for (String item : value.asText().split(",")) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    list.add(trimmed);
                }
            }
        }
        return list;
    }
}

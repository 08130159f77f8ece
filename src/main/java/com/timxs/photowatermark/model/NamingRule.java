package com.timxs.photowatermark.model;

/**
 * 输出文件命名规则
 */
public enum NamingRule {

    /**
     * 保留原文件名
     */
    ORIGINAL("original"),

    /**
     * 添加前缀
     */
    PREFIX("prefix"),

    /**
     * 添加后缀
     */
    SUFFIX("suffix");

    private final String key;

    NamingRule(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 按规则拼接输出文件名
     *
     * @param baseName  不含扩展名的原文件名
     * @param extension 扩展名（带点号）
     * @param prefix    前缀（PREFIX 规则使用）
     * @param suffix    后缀（SUFFIX 规则使用）
     * @return 输出文件名
     */
    public String apply(String baseName, String extension, String prefix, String suffix) {
        return switch (this) {
            case ORIGINAL -> baseName + extension;
            case PREFIX -> nullToEmpty(prefix) + baseName + extension;
            case SUFFIX -> baseName + nullToEmpty(suffix) + extension;
        };
    }

    /**
     * 根据键名或枚举名获取规则，无法识别时返回 ORIGINAL
     */
    public static NamingRule fromKey(String key) {
        if (key == null || key.isBlank()) {
            return ORIGINAL;
        }
        String normalized = key.trim();
        for (NamingRule rule : values()) {
            if (rule.key.equalsIgnoreCase(normalized) || rule.name().equalsIgnoreCase(normalized)) {
                return rule;
            }
        }
        return ORIGINAL;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

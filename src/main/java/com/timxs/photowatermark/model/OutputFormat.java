package com.timxs.photowatermark.model;

/**
 * 导出格式枚举
 * 定义支持的目标格式及其 ImageIO 格式名和扩展名
 */
public enum OutputFormat {

    /**
     * JPEG 格式（有损，不支持透明通道，导出前需要铺白底）
     */
    JPEG("jpeg", ".jpg", false),

    /**
     * PNG 格式（无损，保留透明通道）
     */
    PNG("png", ".png", true);

    /**
     * ImageIO 写入时使用的格式名
     */
    private final String formatName;

    /**
     * 输出文件扩展名（带点号）
     */
    private final String extension;

    /**
     * 是否支持 Alpha 通道
     */
    private final boolean alphaSupported;

    OutputFormat(String formatName, String extension, boolean alphaSupported) {
        this.formatName = formatName;
        this.extension = extension;
        this.alphaSupported = alphaSupported;
    }

    public String getFormatName() {
        return formatName;
    }

    public String getExtension() {
        return extension;
    }

    public boolean isAlphaSupported() {
        return alphaSupported;
    }

    /**
     * 根据名称获取格式，支持 JPEG/JPG/PNG，忽略大小写
     *
     * @param name 格式名称
     * @return 对应的格式，无法识别时返回 JPEG
     */
    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return JPEG;
        }
        String normalized = name.trim().toUpperCase().replace(".", "");
        if ("JPG".equals(normalized)) {
            return JPEG;
        }
        for (OutputFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        return JPEG;
    }
}

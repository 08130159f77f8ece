package com.timxs.photowatermark.model;

/**
 * 水印位置枚举
 * 定义九宫格锚点，用于在不指定坐标时放置水印
 */
public enum WatermarkPosition {

    /**
     * 左上角
     */
    TOP_LEFT("top_left"),

    /**
     * 顶部居中
     */
    TOP_CENTER("top_center"),

    /**
     * 右上角
     */
    TOP_RIGHT("top_right"),

    /**
     * 左侧居中
     */
    MIDDLE_LEFT("middle_left"),

    /**
     * 正中央
     */
    MIDDLE_CENTER("center"),

    /**
     * 右侧居中
     */
    MIDDLE_RIGHT("middle_right"),

    /**
     * 左下角
     */
    BOTTOM_LEFT("bottom_left"),

    /**
     * 底部居中
     */
    BOTTOM_CENTER("bottom_center"),

    /**
     * 右下角（默认）
     */
    BOTTOM_RIGHT("bottom_right");

    /**
     * 设置和模板中使用的键名
     */
    private final String key;

    WatermarkPosition(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 根据键名（如 top_left、center）或枚举名获取位置
     *
     * @param key 键名
     * @return 对应的位置，无法识别时返回 BOTTOM_RIGHT
     */
    public static WatermarkPosition fromKey(String key) {
        if (key == null || key.isBlank()) {
            return BOTTOM_RIGHT;
        }
        String normalized = key.trim();
        for (WatermarkPosition position : values()) {
            if (position.key.equalsIgnoreCase(normalized) || position.name().equalsIgnoreCase(normalized)) {
                return position;
            }
        }
        return BOTTOM_RIGHT;
    }

    /**
     * 计算水印在图片上的 X 坐标
     * 居中时向下取整，水印比图片宽时结果可能为负
     *
     * @param imageWidth     图片宽度
     * @param watermarkWidth 水印宽度
     * @param margin         边距
     * @return X 坐标
     */
    public int calculateX(int imageWidth, int watermarkWidth, int margin) {
        return switch (this) {
            case TOP_LEFT, MIDDLE_LEFT, BOTTOM_LEFT -> margin;
            case TOP_CENTER, MIDDLE_CENTER, BOTTOM_CENTER -> Math.floorDiv(imageWidth - watermarkWidth, 2);
            case TOP_RIGHT, MIDDLE_RIGHT, BOTTOM_RIGHT -> imageWidth - watermarkWidth - margin;
        };
    }

    /**
     * 计算水印在图片上的 Y 坐标
     *
     * @param imageHeight     图片高度
     * @param watermarkHeight 水印高度
     * @param margin          边距
     * @return Y 坐标
     */
    public int calculateY(int imageHeight, int watermarkHeight, int margin) {
        return switch (this) {
            case TOP_LEFT, TOP_CENTER, TOP_RIGHT -> margin;
            case MIDDLE_LEFT, MIDDLE_CENTER, MIDDLE_RIGHT -> Math.floorDiv(imageHeight - watermarkHeight, 2);
            case BOTTOM_LEFT, BOTTOM_CENTER, BOTTOM_RIGHT -> imageHeight - watermarkHeight - margin;
        };
    }
}

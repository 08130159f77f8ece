package com.timxs.photowatermark.model;

/**
 * 水印类型枚举
 * 水印描述对象的标签，合成器只按它分派一次
 */
public enum WatermarkType {
    /**
     * 文字水印
     */
    TEXT,

    /**
     * 图片水印
     */
    IMAGE;

    /**
     * 按名称解析类型，忽略大小写，无法识别时返回 TEXT
     *
     * @param name 类型名称
     * @return 水印类型
     */
    public static WatermarkType fromName(String name) {
        if (name == null || name.isBlank()) {
            return TEXT;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return TEXT;
        }
    }
}

package com.timxs.photowatermark.model;

/**
 * 水印描述（单次渲染期间不可变）
 * 文字和图片两种变体，按 {@link #type()} 区分
 */
public interface WatermarkDescriptor {

    /**
     * 变体标签
     */
    WatermarkType type();

    /**
     * 放置方式
     */
    Placement placement();

    /**
     * 透明度 0-100
     */
    int opacity();

    /**
     * 旋转角度（度），0 表示不旋转
     */
    double rotation();
}

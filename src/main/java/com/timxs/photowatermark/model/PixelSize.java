package com.timxs.photowatermark.model;

import java.awt.image.BufferedImage;

/**
 * 像素尺寸（不可变）
 *
 * @param width  宽度
 * @param height 高度
 */
public record PixelSize(int width, int height) {

    /**
     * 取图片的尺寸
     */
    public static PixelSize of(BufferedImage image) {
        return new PixelSize(image.getWidth(), image.getHeight());
    }

    /**
     * 宽或高不为正数时视为空尺寸
     */
    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}

package com.timxs.photowatermark.model;

/**
 * 像素坐标（不可变），原点在左上角
 *
 * @param x X 坐标
 * @param y Y 坐标
 */
public record PixelPoint(int x, int y) {
}

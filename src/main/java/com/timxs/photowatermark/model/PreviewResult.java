package com.timxs.photowatermark.model;

import java.awt.image.BufferedImage;

/**
 * 预览渲染结果
 *
 * @param image 缩放到预览区域内的图片（已铺白底）
 * @param scale 预览相对原图的缩放比例
 * @param font  本次使用的字体（图片水印时为 null），调用方应记录其来源供导出复用
 */
public record PreviewResult(BufferedImage image, double scale, ResolvedFont font) {
}

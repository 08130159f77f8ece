package com.timxs.photowatermark.service;

import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.model.WatermarkDescriptor;

import java.awt.image.BufferedImage;

/**
 * 水印合成接口
 * 预览和导出调用同一个实现，保证两者输出一致
 */
public interface WatermarkService {

    /**
     * 将水印合成到图片上，不修改输入图片
     *
     * @param image      原始图片
     * @param descriptor 水印描述
     * @param font       文字水印使用的字体（图片水印时可为 null）
     * @param margin     九宫格边距
     * @return 合成后的 ARGB 图片
     */
    BufferedImage render(BufferedImage image, WatermarkDescriptor descriptor, ResolvedFont font, int margin);
}

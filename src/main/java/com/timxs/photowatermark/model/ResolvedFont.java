package com.timxs.photowatermark.model;

import java.awt.Font;
import java.nio.file.Path;

/**
 * 解析后的字体
 * 预览和导出必须使用同一个字形来源，source 用于在导出时原样复用
 *
 * @param font       已按字号派生的字体
 * @param source     字体文件路径，使用平台默认字体时为 null
 * @param realBold   是否为真实粗体字形
 * @param realItalic 是否为真实斜体字形
 */
public record ResolvedFont(Font font, Path source, boolean realBold, boolean realItalic) {

    /**
     * 字号（像素）
     */
    public int size() {
        return font.getSize();
    }

    /**
     * 请求粗体但字体没有真实粗体时需要伪粗体
     *
     * @param boldRequested 是否请求粗体
     * @return 是否需要伪粗体
     */
    public boolean needsPseudoBold(boolean boldRequested) {
        return boldRequested && !realBold;
    }
}

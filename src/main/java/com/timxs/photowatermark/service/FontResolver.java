package com.timxs.photowatermark.service;

import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.model.WatermarkDescriptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 字体解析器接口
 * 预览和导出共用，保证两者选中同一个字形来源
 */
public interface FontResolver {

    /**
     * 解析字体，从不失败：找不到任何字体时返回平台默认字体
     *
     * @param family     请求的字体族
     * @param size       字号（像素）
     * @param bold       是否请求粗体
     * @param italic     是否请求斜体
     * @param sampleText 要绘制的文字，用于判断是否包含中日韩字符
     * @return 解析后的字体
     */
    ResolvedFont resolve(String family, int size, boolean bold, boolean italic, String sampleText);

    /**
     * 复用之前解析到的字体文件，文件不可用时退回 {@link #resolve}
     *
     * @param source     之前解析到的字体文件
     * @param family     请求的字体族
     * @param size       字号（像素）
     * @param bold       是否请求粗体
     * @param italic     是否请求斜体
     * @param sampleText 要绘制的文字
     * @return 解析后的字体
     */
    ResolvedFont fromSource(Path source, String family, int size, boolean bold, boolean italic, String sampleText);

    /**
     * 为文字水印解析字体，预览和导出都通过此方法取字体
     *
     * @param descriptor     水印描述
     * @param resolvedSource 之前解析到的字体文件（可为 null）
     * @return 文字水印的字体，图片水印时为空
     */
    Optional<ResolvedFont> resolveFor(WatermarkDescriptor descriptor, Path resolvedSource);

    /**
     * 字体族的尝试顺序
     * 含中日韩字符时中文字体排在请求的字体族之前
     *
     * @param family     请求的字体族
     * @param sampleText 要绘制的文字
     * @return 尝试顺序
     */
    List<String> searchOrder(String family, String sampleText);
}

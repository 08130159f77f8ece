package com.timxs.photowatermark.service;

import java.awt.Font;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 字形来源加载器
 * 返回的字体为 1px 基准字体，由调用方按字号派生
 */
public interface FontLoader {

    /**
     * 从字体文件加载字体（TTF/TTC/OTF）
     *
     * @param file 字体文件
     * @return 字体，文件无法加载时为空
     */
    Optional<Font> load(Path file);

    /**
     * 按系统已安装的字体族名称查找字体
     *
     * @param family 字体族名称
     * @return 字体，未安装时为空
     */
    Optional<Font> byFamilyName(String family);

    /**
     * 平台默认字体
     */
    Font defaultFont();
}

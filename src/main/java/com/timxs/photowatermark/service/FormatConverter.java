package com.timxs.photowatermark.service;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ImageDecodeException;
import com.timxs.photowatermark.exception.ImageEncodeException;
import com.timxs.photowatermark.model.OutputFormat;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 图片编解码接口
 * 负责读取源图片、按目标格式编码写出以及生成输出文件名
 */
public interface FormatConverter {

    /**
     * 读取图片文件
     *
     * @param file 图片文件
     * @return 解码后的图片
     * @throws ImageDecodeException 文件不存在、为空或无法解码时抛出
     */
    BufferedImage read(Path file) throws ImageDecodeException;

    /**
     * 按目标格式编码图片
     *
     * @param image   图片
     * @param format  目标格式
     * @param quality 输出质量（1-100，仅 JPEG 有效）
     * @return 编码后的字节数组
     * @throws ImageEncodeException 编码失败时抛出
     */
    byte[] convert(BufferedImage image, OutputFormat format, int quality) throws ImageEncodeException;

    /**
     * 编码并写入文件，编码成功后才会创建目标文件
     *
     * @param image   图片
     * @param format  目标格式
     * @param quality 输出质量
     * @param target  目标文件
     * @throws ImageEncodeException 编码或写入失败时抛出
     */
    void write(BufferedImage image, OutputFormat format, int quality, Path target) throws ImageEncodeException;

    /**
     * 将带透明通道的图片铺到白色背景上
     *
     * @param image 图片
     * @return 不透明的 RGB 图片
     */
    BufferedImage flattenOnWhite(BufferedImage image);

    /**
     * 按命名规则和目标格式生成输出文件名
     *
     * @param originalFilename 原始文件名
     * @param settings         导出设置
     * @return 输出文件名
     */
    String outputFilename(String originalFilename, ExportSettings settings);
}

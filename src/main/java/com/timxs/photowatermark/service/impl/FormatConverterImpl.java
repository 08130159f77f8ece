package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ImageDecodeException;
import com.timxs.photowatermark.exception.ImageEncodeException;
import com.timxs.photowatermark.model.OutputFormat;
import com.timxs.photowatermark.service.FormatConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 图片编解码实现
 * 使用 ImageIO 读取源图片并按 JPEG/PNG 编码输出
 */
@Slf4j
@Service
public class FormatConverterImpl implements FormatConverter {

    /**
     * 读取图片
     * 文件句柄只在本方法内打开，解码完成即释放
     *
     * @param file 图片文件
     * @return 解码后的图片
     * @throws ImageDecodeException 文件不存在、为空或无法解码时抛出
     */
    @Override
    public BufferedImage read(Path file) throws ImageDecodeException {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        if (!Files.isRegularFile(file)) {
            throw new ImageDecodeException("File not found: " + file);
        }
        try {
            if (Files.size(file) == 0) {
                throw new ImageDecodeException("Empty image file");
            }
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                throw new ImageDecodeException("Unsupported or corrupt image data");
            }
            log.debug("图片读取成功: {} ({}x{}, 类型: {})",
                file.getFileName(), image.getWidth(), image.getHeight(), image.getType());
            return image;
        } catch (ImageDecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // ImageIO 遇到损坏数据时也可能抛出运行时异常
            throw new ImageDecodeException("Cannot decode image: " + e.getMessage(), e);
        }
    }

    /**
     * 转换图片格式
     * JPEG 不支持 Alpha 通道，编码前先铺白底
     *
     * @param image   图片
     * @param format  目标格式
     * @param quality 输出质量（1-100，仅 JPEG 有效）
     * @return 编码后的字节数组
     * @throws ImageEncodeException 编码失败时抛出
     */
    @Override
    public byte[] convert(BufferedImage image, OutputFormat format, int quality) throws ImageEncodeException {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Target format must be specified");
        }

        log.debug("开始编码，图片尺寸: {}x{}, 类型: {}, 目标格式: {}, 质量: {}",
            image.getWidth(), image.getHeight(), image.getType(), format, quality);

        BufferedImage imageToWrite = format.isAlphaSupported() ? image : flattenOnWhite(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.getFormatName());
        if (!writers.hasNext()) {
            throw new ImageEncodeException("No appropriate writer found for format: " + format);
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(outputStream)) {
            writer.setOutput(ios);

            ImageWriteParam param = writer.getDefaultWriteParam();
            if (format == OutputFormat.JPEG && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                // 质量参数范围 0.0-1.0
                param.setCompressionQuality(Math.max(1, Math.min(100, quality)) / 100.0f);
            }

            writer.write(null, new IIOImage(imageToWrite, null, null), param);
        } catch (IOException | RuntimeException e) {
            throw new ImageEncodeException("Failed to encode image as " + format + ": " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        log.debug("Encoded image as {} with quality {}, size: {} KB",
            format, quality, String.format("%.2f", outputStream.size() / 1024.0));
        return outputStream.toByteArray();
    }

    @Override
    public void write(BufferedImage image, OutputFormat format, int quality, Path target) throws ImageEncodeException {
        byte[] data = convert(image, format, quality);
        try {
            Files.write(target, data);
        } catch (IOException e) {
            throw new ImageEncodeException("Cannot write " + target.getFileName() + ": " + e, e);
        }
        log.debug("已写入: {} ({} bytes)", target, data.length);
    }

    /**
     * 将带 Alpha 通道的图片转换为 RGB
     * 透明区域填充为白色：out = fg * alpha + 255 * (1 - alpha)
     *
     * @param src 源图片
     * @return RGB 格式的图片
     */
    @Override
    public BufferedImage flattenOnWhite(BufferedImage src) {
        int width = src.getWidth();
        int height = src.getHeight();
        int[] pixels = src.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            int argb = pixels[i];
            int alpha = argb >>> 24;
            int r = ((argb >> 16) & 0xFF) * alpha / 255 + 255 * (255 - alpha) / 255;
            int g = ((argb >> 8) & 0xFF) * alpha / 255 + 255 * (255 - alpha) / 255;
            int b = (argb & 0xFF) * alpha / 255 + 255 * (255 - alpha) / 255;
            pixels[i] = (Math.min(255, r) << 16) | (Math.min(255, g) << 8) | Math.min(255, b);
        }
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, width, height, pixels, 0, width);
        return rgb;
    }

    /**
     * 生成输出文件名
     * 扩展名由目标格式决定：JPEG 统一为 .jpg，PNG 统一为 .png
     *
     * @param originalFilename 原始文件名
     * @param settings         导出设置
     * @return 输出文件名
     */
    @Override
    public String outputFilename(String originalFilename, ExportSettings settings) {
        String baseName;
        if (originalFilename == null || originalFilename.isBlank()) {
            baseName = "image";
        } else {
            // 去掉扩展名
            int lastDotIndex = originalFilename.lastIndexOf('.');
            baseName = lastDotIndex > 0 ? originalFilename.substring(0, lastDotIndex) : originalFilename;
        }
        return settings.namingRule().apply(baseName, settings.format().getExtension(),
            settings.prefix(), settings.suffix());
    }
}

package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.ImageWatermarkConfig;
import com.timxs.photowatermark.config.TextWatermarkConfig;
import com.timxs.photowatermark.exception.ImageDecodeException;
import com.timxs.photowatermark.model.PixelPoint;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.model.WatermarkDescriptor;
import com.timxs.photowatermark.service.FormatConverter;
import com.timxs.photowatermark.service.PositionMapper;
import com.timxs.photowatermark.service.WatermarkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.awt.font.GlyphVector;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * 水印合成实现
 * 使用 Java 2D Graphics API 在透明图层上绘制水印，再按 "over" 运算合成到原图
 * 支持文字水印和图片水印两种类型
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatermarkServiceImpl implements WatermarkService {

    /**
     * 阴影相对文字的偏移（像素）
     */
    static final int SHADOW_OFFSET = 2;

    /**
     * 伪粗体叠描偏移
     */
    static final List<PixelPoint> PSEUDO_BOLD_OFFSETS = List.of(
        new PixelPoint(0, 0), new PixelPoint(1, 0), new PixelPoint(0, 1), new PixelPoint(1, 1));

    private static final List<PixelPoint> SINGLE_PASS = List.of(new PixelPoint(0, 0));

    /**
     * 坐标换算
     */
    private final PositionMapper positionMapper;

    /**
     * 用于读取水印图片
     */
    private final FormatConverter formatConverter;

    /**
     * 合成水印
     *
     * @param image      原始图片
     * @param descriptor 水印描述
     * @param font       文字水印字体
     * @param margin     九宫格边距
     * @return 合成后的图片
     * @throws IllegalArgumentException 图片为空，或文字水印缺少字体时抛出
     */
    @Override
    public BufferedImage render(BufferedImage image, WatermarkDescriptor descriptor, ResolvedFont font, int margin) {
        if (image == null) {
            throw new IllegalArgumentException("Image cannot be null");
        }

        log.debug("开始合成水印，原图尺寸: {}x{}, 类型: {}", image.getWidth(), image.getHeight(), image.getType());

        // 统一为 ARGB 副本，不修改输入
        BufferedImage result = toArgb(image);
        if (descriptor == null) {
            return result;
        }

        // 与原图同尺寸的透明水印层
        BufferedImage overlay = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        switch (descriptor.type()) {
            case TEXT -> drawText(overlay, (TextWatermarkConfig) descriptor, font, margin);
            case IMAGE -> drawImage(overlay, (ImageWatermarkConfig) descriptor, margin);
        }

        alphaComposite(result, overlay);
        return result;
    }

    /**
     * 绘制次数与偏移：请求粗体且字体没有真实粗体时叠描四次，否则绘制一次
     *
     * @param boldRequested 是否请求粗体
     * @param font          字体
     * @return 每次绘制的偏移
     */
    static List<PixelPoint> glyphPassOffsets(boolean boldRequested, ResolvedFont font) {
        return font.needsPseudoBold(boldRequested) ? PSEUDO_BOLD_OFFSETS : SINGLE_PASS;
    }

    /**
     * 在水印层上绘制文字
     */
    private void drawText(BufferedImage overlay, TextWatermarkConfig config, ResolvedFont font, int margin) {
        if (!config.hasContent()) {
            return;
        }
        if (font == null) {
            throw new IllegalArgumentException("Resolved font is required for text watermark");
        }

        Graphics2D g2d = overlay.createGraphics();
        try {
            // 设置抗锯齿，提高文字渲染质量
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);

            Font awtFont = font.size() == config.fontSize()
                ? font.font()
                : font.font().deriveFont((float) Math.max(1, config.fontSize()));
            g2d.setFont(awtFont);

            // 文字的紧凑包围盒
            GlyphVector glyphs = awtFont.createGlyphVector(g2d.getFontRenderContext(), config.content());
            Rectangle2D bounds = glyphs.getVisualBounds();
            PixelSize textSize = new PixelSize(
                Math.max(1, (int) Math.ceil(bounds.getWidth())),
                Math.max(1, (int) Math.ceil(bounds.getHeight())));

            PixelPoint position = positionMapper.place(config.placement(), PixelSize.of(overlay), textSize, margin);

            // 包围盒左上角对齐到计算出的位置
            float originX = (float) (position.x() - bounds.getX());
            float originY = (float) (position.y() - bounds.getY());

            if (config.rotation() != 0) {
                // 正角度为逆时针，绕包围盒中心旋转
                g2d.rotate(-Math.toRadians(config.rotation()),
                    position.x() + textSize.width() / 2.0, position.y() + textSize.height() / 2.0);
            }

            Color color = config.drawColor();
            log.debug("水印颜色: R={}, G={}, B={}, A={}",
                color.getRed(), color.getGreen(), color.getBlue(), color.getAlpha());
            log.debug("水印文字尺寸: {}x{}, 位置: ({}, {}), 字体: {}",
                textSize.width(), textSize.height(), position.x(), position.y(), awtFont.getFontName());

            // 直接写入水印层，重叠的笔画和阴影不累积透明度
            g2d.setComposite(AlphaComposite.Src);

            // 阴影先于文字绘制，文字覆盖阴影
            if (config.shadow()) {
                g2d.setColor(new Color(0, 0, 0, color.getAlpha() / 2));
                g2d.drawString(config.content(), originX + SHADOW_OFFSET, originY + SHADOW_OFFSET);
            }

            g2d.setColor(color);
            List<PixelPoint> passes = glyphPassOffsets(config.bold(), font);
            if (passes.size() > 1) {
                log.debug("字体没有真实粗体，使用伪粗体");
            }
            for (PixelPoint offset : passes) {
                g2d.drawString(config.content(), originX + offset.x(), originY + offset.y());
            }
        } finally {
            g2d.dispose();
        }
    }

    /**
     * 在水印层上绘制图片水印
     * 水印图片缺失或无法读取时不绘制
     */
    private void drawImage(BufferedImage overlay, ImageWatermarkConfig config, int margin) {
        if (config.sourcePath() == null) {
            log.debug("未设置水印图片，跳过");
            return;
        }

        BufferedImage watermark;
        try {
            watermark = toArgb(formatConverter.read(config.sourcePath()));
        } catch (ImageDecodeException e) {
            log.warn("水印图片加载失败，跳过图片水印: {} - {}", config.sourcePath(), e.getMessage());
            return;
        }

        if (config.scalePercent() != null && config.scalePercent() != 100) {
            watermark = scale(watermark, config.scalePercent());
        }
        if (config.rotation() != 0) {
            watermark = rotate(watermark, config.rotation());
        }
        if (config.opacity() < 100) {
            multiplyAlpha(watermark, config.opacity());
        }

        PixelPoint position = positionMapper.place(config.placement(), PixelSize.of(overlay),
            PixelSize.of(watermark), margin);
        pasteWithMask(overlay, watermark, position);

        log.debug("Added image watermark at position ({}, {}) with size {}x{}",
            position.x(), position.y(), watermark.getWidth(), watermark.getHeight());
    }

    /**
     * 复制为 TYPE_INT_ARGB 图片
     */
    static BufferedImage toArgb(BufferedImage src) {
        int width = src.getWidth();
        int height = src.getHeight();
        BufferedImage argb = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] pixels = src.getRGB(0, 0, width, height, null, 0, width);
        argb.setRGB(0, 0, width, height, pixels, 0, width);
        return argb;
    }

    /**
     * 按百分比缩放，使用双线性插值
     */
    private BufferedImage scale(BufferedImage src, int percent) {
        int width = Math.max(1, (int) ((long) src.getWidth() * percent / 100));
        int height = Math.max(1, (int) ((long) src.getHeight() * percent / 100));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = scaled.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setComposite(AlphaComposite.Src);
            g2d.drawImage(src, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return scaled;
    }

    /**
     * 绕自身中心旋转，画布扩大到能容纳旋转后的图片
     * 正角度为逆时针
     */
    private BufferedImage rotate(BufferedImage src, double degrees) {
        double radians = -Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int width = src.getWidth();
        int height = src.getHeight();
        int rotatedWidth = Math.max(1, (int) Math.round(width * cos + height * sin));
        int rotatedHeight = Math.max(1, (int) Math.round(width * sin + height * cos));

        BufferedImage rotated = new BufferedImage(rotatedWidth, rotatedHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = rotated.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.translate((rotatedWidth - width) / 2.0, (rotatedHeight - height) / 2.0);
            g2d.rotate(radians, width / 2.0, height / 2.0);
            g2d.drawImage(src, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rotated;
    }

    /**
     * Alpha 通道乘以透明度：new_alpha = old_alpha * opacity / 100（截断）
     */
    static void multiplyAlpha(BufferedImage image, int opacity) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            int alpha = (pixels[i] >>> 24) * opacity / 100;
            pixels[i] = (alpha << 24) | (pixels[i] & 0x00FFFFFF);
        }
        image.setRGB(0, 0, width, height, pixels, 0, width);
    }

    /**
     * 以水印自身的 Alpha 为蒙版粘贴到水印层，超出水印层的部分被裁掉
     * 每个通道（含 Alpha）：out = src * mask + dst * (1 - mask)
     */
    static void pasteWithMask(BufferedImage dst, BufferedImage src, PixelPoint position) {
        int startX = Math.max(0, position.x());
        int startY = Math.max(0, position.y());
        int endX = Math.min(dst.getWidth(), position.x() + src.getWidth());
        int endY = Math.min(dst.getHeight(), position.y() + src.getHeight());
        if (startX >= endX || startY >= endY) {
            return;
        }

        for (int y = startY; y < endY; y++) {
            for (int x = startX; x < endX; x++) {
                int s = src.getRGB(x - position.x(), y - position.y());
                int mask = s >>> 24;
                if (mask == 0) {
                    continue;
                }
                int d = dst.getRGB(x, y);
                int out = 0;
                for (int shift = 0; shift <= 24; shift += 8) {
                    int sc = (s >>> shift) & 0xFF;
                    int dc = (d >>> shift) & 0xFF;
                    int c = (sc * mask + dc * (255 - mask)) / 255;
                    out |= c << shift;
                }
                dst.setRGB(x, y, out);
            }
        }
    }

    /**
     * 将水印层按 "over" 运算合成到目标图片（就地修改 dst）
     * outA = srcA + dstA * (1 - srcA)
     * outC = (srcC * srcA + dstC * dstA * (1 - srcA)) / outA
     * 全部使用 0-255 整数运算并截断
     */
    static void alphaComposite(BufferedImage dst, BufferedImage src) {
        int width = dst.getWidth();
        int height = dst.getHeight();
        int[] dstPixels = dst.getRGB(0, 0, width, height, null, 0, width);
        int[] srcPixels = src.getRGB(0, 0, width, height, null, 0, width);

        for (int i = 0; i < dstPixels.length; i++) {
            int s = srcPixels[i];
            int srcAlpha = s >>> 24;
            if (srcAlpha == 0) {
                continue;
            }
            int d = dstPixels[i];
            int dstAlpha = d >>> 24;
            int blend = dstAlpha * (255 - srcAlpha) / 255;
            int outAlpha = srcAlpha + blend;

            int out = outAlpha << 24;
            for (int shift = 0; shift <= 16; shift += 8) {
                int sc = (s >>> shift) & 0xFF;
                int dc = (d >>> shift) & 0xFF;
                int c = (sc * srcAlpha + dc * blend) / outAlpha;
                out |= Math.min(255, c) << shift;
            }
            dstPixels[i] = out;
        }
        dst.setRGB(0, 0, width, height, dstPixels, 0, width);
    }
}

package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ImageDecodeException;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.PreviewResult;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.service.FontResolver;
import com.timxs.photowatermark.service.FormatConverter;
import com.timxs.photowatermark.service.PositionMapper;
import com.timxs.photowatermark.service.PreviewService;
import com.timxs.photowatermark.service.WatermarkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 预览渲染实现
 * 与导出走同一条合成路径：在原图分辨率上合成，再缩放显示
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PreviewServiceImpl implements PreviewService {

    private final WatermarkService watermarkService;

    private final FormatConverter formatConverter;

    private final FontResolver fontResolver;

    private final PositionMapper positionMapper;

    @Override
    public PreviewResult renderPreview(Path image, ExportSettings settings, PixelSize viewport)
        throws ImageDecodeException {
        BufferedImage original = formatConverter.read(image);
        ResolvedFont font = fontResolver.resolveFor(settings.watermark(), settings.resolvedFontSource())
            .orElse(null);

        BufferedImage watermarked = watermarkService.render(original, settings.watermark(), font, settings.margin());
        BufferedImage flattened = formatConverter.flattenOnWhite(watermarked);

        // 与坐标换算使用同一个缩放比例
        double scale = positionMapper.previewScale(PixelSize.of(original), viewport);
        if (scale <= 0) {
            log.debug("预览区域无效，按原尺寸返回: {}", viewport);
            return new PreviewResult(flattened, 1.0, font);
        }

        int width = Math.max(1, (int) Math.round(original.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(original.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = scaled.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(flattened, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }

        log.debug("预览生成: {} {}x{} -> {}x{}, 字体来源: {}", image.getFileName(),
            original.getWidth(), original.getHeight(), width, height, font == null ? "-" : font.source());
        return new PreviewResult(scaled, scale, font);
    }
}

package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.NamingRule;
import com.timxs.photowatermark.model.OutputFormat;
import com.timxs.photowatermark.model.WatermarkDescriptor;
import com.timxs.photowatermark.model.WatermarkType;

import java.nio.file.Path;

/**
 * 导出设置快照
 * 批次开始时从实时配置按值复制一次，之后对界面配置的修改不会影响已开始的导出
 *
 * @param format             输出格式
 * @param quality            输出质量（1-100，仅 JPEG 有效）
 * @param namingRule         命名规则
 * @param prefix             前缀
 * @param suffix             后缀
 * @param watermark          水印描述
 * @param resolvedFontSource 预览时解析到的字体文件（可为 null）
 * @param margin             九宫格边距（像素）
 */
public record ExportSettings(
    OutputFormat format,
    int quality,
    NamingRule namingRule,
    String prefix,
    String suffix,
    WatermarkDescriptor watermark,
    Path resolvedFontSource,
    int margin
) {

    public ExportSettings {
        if (watermark == null) {
            throw new IllegalArgumentException("Watermark descriptor cannot be null");
        }
        format = format == null ? OutputFormat.JPEG : format;
        namingRule = namingRule == null ? NamingRule.ORIGINAL : namingRule;
        quality = Math.max(1, Math.min(100, quality));
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    /**
     * 从实时配置创建快照
     *
     * @param config 工作台配置
     * @return 不可变的导出设置
     */
    public static ExportSettings snapshot(StudioConfig config) {
        WatermarkConfig watermarkConfig = config.getWatermark();
        ExportConfig exportConfig = config.getExport();

        WatermarkDescriptor descriptor = watermarkConfig.getType() == WatermarkType.IMAGE
            ? ImageWatermarkConfig.from(watermarkConfig, config.previewViewport())
            : TextWatermarkConfig.from(watermarkConfig, config.previewViewport());

        String fontPath = watermarkConfig.getResolvedFontPath();
        return new ExportSettings(
            exportConfig.getFormat(),
            exportConfig.getQuality(),
            exportConfig.getNamingRule(),
            exportConfig.getPrefix(),
            exportConfig.getSuffix(),
            descriptor,
            fontPath == null || fontPath.isBlank() ? null : Path.of(fontPath),
            config.getMargin()
        );
    }
}

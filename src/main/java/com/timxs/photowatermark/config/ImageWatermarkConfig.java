package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.WatermarkDescriptor;
import com.timxs.photowatermark.model.WatermarkType;

import java.nio.file.Path;

/**
 * 图片水印配置 record
 *
 * @param sourcePath   水印图片路径（可为 null，此时不绘制）
 * @param scalePercent 缩放百分比，null 表示原始大小
 * @param placement    放置方式
 * @param opacity      透明度 0-100
 * @param rotation     旋转角度（度）
 */
public record ImageWatermarkConfig(
    Path sourcePath,
    Integer scalePercent,
    Placement placement,
    int opacity,
    double rotation
) implements WatermarkDescriptor {

    public ImageWatermarkConfig {
        placement = placement == null ? Placement.anchored(null) : placement;
        opacity = Math.max(0, Math.min(100, opacity));
        if (scalePercent != null && scalePercent <= 0) {
            scalePercent = null;
        }
    }

    /**
     * 从 WatermarkConfig 创建 ImageWatermarkConfig
     *
     * @param config   水印配置
     * @param viewport 预览区域尺寸
     */
    public static ImageWatermarkConfig from(WatermarkConfig config, PixelSize viewport) {
        String imagePath = config.getImagePath();
        return new ImageWatermarkConfig(
            imagePath == null || imagePath.isBlank() ? null : Path.of(imagePath),
            config.getImageScale(),
            config.toPlacement(viewport),
            config.getImageOpacity(),
            config.getRotation()
        );
    }

    @Override
    public WatermarkType type() {
        return WatermarkType.IMAGE;
    }
}

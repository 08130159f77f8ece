package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.WatermarkDescriptor;
import com.timxs.photowatermark.model.WatermarkType;
import lombok.extern.slf4j.Slf4j;

import java.awt.Color;

/**
 * 文字水印配置 record
 *
 * @param content    水印文字，为空时不绘制
 * @param fontFamily 字体名称
 * @param fontSize   字体大小（像素）
 * @param bold       是否粗体
 * @param italic     是否斜体
 * @param shadow     是否添加阴影
 * @param color      颜色（含基础透明度）
 * @param placement  放置方式
 * @param opacity    透明度 0-100
 * @param rotation   旋转角度（度）
 */
@Slf4j
public record TextWatermarkConfig(
    String content,
    String fontFamily,
    int fontSize,
    boolean bold,
    boolean italic,
    boolean shadow,
    Color color,
    Placement placement,
    int opacity,
    double rotation
) implements WatermarkDescriptor {

    public TextWatermarkConfig {
        content = content == null ? "" : content;
        color = color == null ? Color.WHITE : color;
        placement = placement == null ? Placement.anchored(null) : placement;
        opacity = Math.max(0, Math.min(100, opacity));
    }

    /**
     * 从 WatermarkConfig 创建 TextWatermarkConfig
     *
     * @param config   水印配置
     * @param viewport 预览区域尺寸
     */
    public static TextWatermarkConfig from(WatermarkConfig config, PixelSize viewport) {
        return new TextWatermarkConfig(
            config.getText(),
            config.getFontFamily(),
            config.getFontSize(),
            config.isBold(),
            config.isItalic(),
            config.isShadow(),
            parseColor(config.getColor(), config.getColorAlpha()),
            config.toPlacement(viewport),
            config.getOpacity(),
            config.getRotation()
        );
    }

    @Override
    public WatermarkType type() {
        return WatermarkType.TEXT;
    }

    /**
     * 是否有需要绘制的文字
     */
    public boolean hasContent() {
        return !content.isEmpty();
    }

    /**
     * 最终绘制颜色：RGB 取自配置颜色，Alpha 由透明度换算（0-100 映射到 0-255）
     */
    public Color drawColor() {
        int alpha = (int) Math.round(255 * opacity / 100.0);
        return new Color(color.getRed(), color.getGreen(), color.getBlue(), alpha);
    }

    /**
     * 解析颜色字符串
     * 支持十六进制格式（如 #FFFFFF、FFFFFF，或带 Alpha 的 #AARRGGBB）
     *
     * @param colorStr  颜色字符串
     * @param baseAlpha 未指定 Alpha 时使用的基础透明度（0-255）
     * @return Color 对象，格式无效时返回白色
     */
    public static Color parseColor(String colorStr, int baseAlpha) {
        int alpha = Math.max(0, Math.min(255, baseAlpha));
        if (colorStr == null || colorStr.isBlank()) {
            return new Color(255, 255, 255, alpha);
        }

        String hex = colorStr.trim();
        hex = hex.startsWith("#") ? hex.substring(1) : hex;
        try {
            if (hex.length() == 6) {
                int rgb = Integer.parseInt(hex, 16);
                return new Color((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF, alpha);
            }
            if (hex.length() == 8) {
                long argb = Long.parseLong(hex, 16);
                return new Color((int) (argb >> 16) & 0xFF, (int) (argb >> 8) & 0xFF,
                    (int) argb & 0xFF, (int) (argb >> 24) & 0xFF);
            }
        } catch (NumberFormatException e) {
            // 落到下方的默认值
        }
        log.warn("Invalid color format: {}, using white", colorStr);
        return new Color(255, 255, 255, alpha);
    }
}

package com.timxs.photowatermark.model;

/**
 * 水印放置方式
 * 锚点和自定义坐标二选一：存在自定义坐标时以自定义坐标为准
 *
 * @param anchor         九宫格锚点
 * @param customPosition 预览区域内的自定义坐标（可为 null）
 * @param viewport       记录自定义坐标时的预览区域尺寸，换算回原图坐标时使用
 */
public record Placement(WatermarkPosition anchor, PixelPoint customPosition, PixelSize viewport) {

    public Placement {
        if (anchor == null) {
            anchor = WatermarkPosition.BOTTOM_RIGHT;
        }
        if (customPosition != null && viewport == null) {
            throw new IllegalArgumentException("Custom position requires the preview viewport size");
        }
    }

    /**
     * 使用锚点放置
     */
    public static Placement anchored(WatermarkPosition anchor) {
        return new Placement(anchor, null, null);
    }

    /**
     * 使用预览区域内的自定义坐标放置
     */
    public static Placement custom(PixelPoint previewPoint, PixelSize viewport) {
        return new Placement(WatermarkPosition.BOTTOM_RIGHT, previewPoint, viewport);
    }

    public boolean isCustom() {
        return customPosition != null;
    }
}

package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.PixelPoint;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.WatermarkPosition;
import com.timxs.photowatermark.model.WatermarkType;
import lombok.Data;

/**
 * 水印配置
 * 交互界面实时编辑的可变配置，包含文字水印和图片水印的所有配置项
 * 导出时通过 {@link ExportSettings#snapshot(StudioConfig)} 冻结
 */
@Data
public class WatermarkConfig {

    /**
     * 水印类型（TEXT 或 IMAGE）
     */
    private WatermarkType type = WatermarkType.TEXT;

    // ========== 文字水印配置 ==========

    /**
     * 水印文字
     */
    private String text = "水印文字";

    /**
     * 字体名称
     */
    private String fontFamily = "Microsoft YaHei";

    /**
     * 字体大小（像素）
     */
    private int fontSize = 24;

    /**
     * 是否粗体
     */
    private boolean bold = false;

    /**
     * 是否斜体
     */
    private boolean italic = false;

    /**
     * 是否添加阴影
     */
    private boolean shadow = false;

    /**
     * 颜色（十六进制，如 #FFFFFF）
     */
    private String color = "#FFFFFF";

    /**
     * 颜色基础透明度（0-255）
     */
    private int colorAlpha = 180;

    /**
     * 文字透明度（0-100）
     */
    private int opacity = 70;

    /**
     * 预览时解析到的字体文件，导出时原样复用
     */
    private String resolvedFontPath;

    // ========== 图片水印配置 ==========

    /**
     * 水印图片路径
     */
    private String imagePath = "";

    /**
     * 图片水印透明度（0-100）
     */
    private int imageOpacity = 70;

    /**
     * 图片水印缩放百分比，为空表示原始大小
     */
    private Integer imageScale;

    // ========== 通用配置 ==========

    /**
     * 水印位置（九宫格）
     */
    private WatermarkPosition position = WatermarkPosition.BOTTOM_RIGHT;

    /**
     * 拖拽得到的预览区域 X 坐标，为空表示使用九宫格位置
     */
    private Integer customX;

    /**
     * 拖拽得到的预览区域 Y 坐标
     */
    private Integer customY;

    /**
     * 旋转角度（度）
     */
    private double rotation = 0;

    /**
     * 清除自定义坐标，回到九宫格位置
     */
    public void clearCustomPosition() {
        this.customX = null;
        this.customY = null;
    }

    /**
     * 根据当前设置构建放置方式
     *
     * @param viewport 预览区域尺寸
     * @return 放置方式
     */
    public Placement toPlacement(PixelSize viewport) {
        if (customX != null && customY != null) {
            return Placement.custom(new PixelPoint(customX, customY), viewport);
        }
        return Placement.anchored(position);
    }
}

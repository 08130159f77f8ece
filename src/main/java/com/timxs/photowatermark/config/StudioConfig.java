package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.service.PositionMapper;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 工作台配置
 * 包含水印、导出、预览区域和字体目录等设置
 */
@Data
public class StudioConfig {

    // ========== 水印设置 ==========

    /**
     * 水印配置
     */
    private WatermarkConfig watermark = new WatermarkConfig();

    // ========== 导出设置 ==========

    /**
     * 导出配置
     */
    private ExportConfig export = new ExportConfig();

    // ========== 布局设置 ==========

    /**
     * 九宫格位置的边距（像素）
     */
    private int margin = PositionMapper.DEFAULT_MARGIN;

    /**
     * 预览区域宽度（像素）
     */
    private int previewWidth = 400;

    /**
     * 预览区域高度（像素）
     */
    private int previewHeight = 300;

    // ========== 资源设置 ==========

    /**
     * 字体目录，为空时使用系统字体目录
     */
    private List<String> fontDirectories = new ArrayList<>();

    /**
     * 模板文件路径
     */
    private String templateFile = "templates.json";

    public PixelSize previewViewport() {
        return new PixelSize(previewWidth, previewHeight);
    }
}

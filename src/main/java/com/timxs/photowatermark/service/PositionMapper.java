package com.timxs.photowatermark.service;

import com.timxs.photowatermark.model.PixelPoint;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.WatermarkPosition;

/**
 * 坐标换算接口
 * 拖拽预览和最终导出都通过它计算水印左上角在原图中的坐标
 */
public interface PositionMapper {

    /**
     * 默认边距（像素）
     */
    int DEFAULT_MARGIN = 20;

    /**
     * 输入无效时返回的默认坐标
     */
    PixelPoint DEFAULT_POSITION = new PixelPoint(20, 20);

    /**
     * 按九宫格锚点计算坐标
     *
     * @param container 容器（原图）尺寸
     * @param overlay   水印尺寸
     * @param anchor    锚点
     * @param margin    边距
     * @return 水印左上角坐标
     */
    PixelPoint anchorPosition(PixelSize container, PixelSize overlay, WatermarkPosition anchor, int margin);

    /**
     * 将预览区域中的坐标换算为原图坐标，并保证水印完整落在原图内
     *
     * @param previewPoint 预览坐标
     * @param image        原图尺寸
     * @param overlay      水印尺寸
     * @param viewport     预览区域尺寸
     * @return 原图坐标，输入无效时返回 {@link #DEFAULT_POSITION}
     */
    PixelPoint previewToImage(PixelPoint previewPoint, PixelSize image, PixelSize overlay, PixelSize viewport);

    /**
     * 按放置方式计算坐标：有自定义坐标时换算自定义坐标，否则按锚点计算
     *
     * @param placement 放置方式
     * @param image     原图尺寸
     * @param overlay   水印尺寸
     * @param margin    锚点边距
     * @return 水印左上角坐标
     */
    PixelPoint place(Placement placement, PixelSize image, PixelSize overlay, int margin);

    /**
     * 原图等比缩放到预览区域内的比例
     *
     * @param image    原图尺寸
     * @param viewport 预览区域尺寸
     * @return 缩放比例，输入无效时返回 0
     */
    double previewScale(PixelSize image, PixelSize viewport);
}

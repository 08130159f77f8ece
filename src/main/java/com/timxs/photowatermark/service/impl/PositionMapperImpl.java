package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.model.PixelPoint;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.WatermarkPosition;
import com.timxs.photowatermark.service.PositionMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 坐标换算实现
 */
@Slf4j
@Service
public class PositionMapperImpl implements PositionMapper {

    @Override
    public PixelPoint anchorPosition(PixelSize container, PixelSize overlay, WatermarkPosition anchor, int margin) {
        WatermarkPosition position = anchor == null ? WatermarkPosition.BOTTOM_RIGHT : anchor;
        int x = position.calculateX(container.width(), overlay.width(), margin);
        int y = position.calculateY(container.height(), overlay.height(), margin);
        return new PixelPoint(x, y);
    }

    @Override
    public PixelPoint previewToImage(PixelPoint previewPoint, PixelSize image, PixelSize overlay, PixelSize viewport) {
        if (previewPoint == null || image == null || viewport == null || image.isEmpty() || viewport.isEmpty()) {
            log.debug("预览坐标换算输入无效，使用默认位置: image={}, viewport={}", image, viewport);
            return DEFAULT_POSITION;
        }

        double scale = previewScale(image, viewport);
        // 截断取整
        int imageX = (int) (previewPoint.x() / scale);
        int imageY = (int) (previewPoint.y() / scale);

        // 保证水印不超出原图
        int overlayWidth = overlay == null ? 0 : overlay.width();
        int overlayHeight = overlay == null ? 0 : overlay.height();
        int x = Math.max(0, Math.min(imageX, image.width() - overlayWidth));
        int y = Math.max(0, Math.min(imageY, image.height() - overlayHeight));

        log.debug("预览坐标 ({}, {}) -> 原图坐标 ({}, {}), 缩放比例: {}",
            previewPoint.x(), previewPoint.y(), x, y, scale);
        return new PixelPoint(x, y);
    }

    @Override
    public PixelPoint place(Placement placement, PixelSize image, PixelSize overlay, int margin) {
        if (placement != null && placement.isCustom()) {
            return previewToImage(placement.customPosition(), image, overlay, placement.viewport());
        }
        WatermarkPosition anchor = placement == null ? WatermarkPosition.BOTTOM_RIGHT : placement.anchor();
        return anchorPosition(image, overlay, anchor, margin);
    }

    @Override
    public double previewScale(PixelSize image, PixelSize viewport) {
        if (image == null || viewport == null || image.isEmpty() || viewport.isEmpty()) {
            return 0;
        }
        double scaleX = (double) viewport.width() / image.width();
        double scaleY = (double) viewport.height() / image.height();
        return Math.min(scaleX, scaleY);
    }
}

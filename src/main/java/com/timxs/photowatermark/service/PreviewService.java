package com.timxs.photowatermark.service;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ImageDecodeException;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.PreviewResult;

import java.nio.file.Path;

/**
 * 预览渲染接口
 */
public interface PreviewService {

    /**
     * 按原图分辨率合成水印，再等比缩放到预览区域
     *
     * @param image    原图文件
     * @param settings 当前设置的快照
     * @param viewport 预览区域尺寸
     * @return 预览结果
     * @throws ImageDecodeException 原图无法读取时抛出
     */
    PreviewResult renderPreview(Path image, ExportSettings settings, PixelSize viewport) throws ImageDecodeException;
}

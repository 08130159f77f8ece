package com.timxs.photowatermark.exception;

import java.io.IOException;

/**
 * 图片编码或写入失败（权限不足、磁盘已满、不支持的颜色模式等）
 */
public class ImageEncodeException extends IOException {

    public ImageEncodeException(String message) {
        super(message);
    }

    public ImageEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.timxs.photowatermark.exception;

import java.io.IOException;

/**
 * 图片无法读取或已损坏
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.timxs.photowatermark.exception;

/**
 * 导出前置校验失败（未指定输出目录、输出目录与源图片目录相同等）
 * 在处理任何文件之前抛出，批次不会写入任何文件
 */
public class ExportValidationException extends RuntimeException {

    public ExportValidationException(String message) {
        super(message);
    }
}

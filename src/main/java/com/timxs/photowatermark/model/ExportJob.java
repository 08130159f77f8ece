package com.timxs.photowatermark.model;

import com.timxs.photowatermark.config.ExportSettings;

import java.nio.file.Path;

/**
 * 单个导出任务：输入文件 + 批次开始时冻结的导出设置
 *
 * @param source   输入图片路径
 * @param settings 导出设置快照
 */
public record ExportJob(Path source, ExportSettings settings) {

    /**
     * 输入文件名（不含目录）
     */
    public String filename() {
        Path name = source.getFileName();
        return name == null ? source.toString() : name.toString();
    }
}

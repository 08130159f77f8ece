package com.timxs.photowatermark.model;

/**
 * 导出进度通知，每个文件尝试一次（无论成功失败）发送一次
 *
 * @param current  当前序号（从 1 开始）
 * @param total    总数
 * @param filename 当前文件名
 */
public record ExportProgress(int current, int total, String filename) {
}

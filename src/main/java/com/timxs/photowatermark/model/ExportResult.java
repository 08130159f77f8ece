package com.timxs.photowatermark.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量导出结果
 *
 * @param successCount 成功数量
 * @param errorCount   失败数量
 * @param errors       失败详情（"文件名: 错误信息"），按输入顺序排列
 */
public record ExportResult(int successCount, int errorCount, List<String> errors) {

    /**
     * 摘要中最多展示的错误条数
     */
    public static final int MAX_SUMMARY_ERRORS = 5;

    public ExportResult {
        errors = List.copyOf(errors);
    }

    public int total() {
        return successCount + errorCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    /**
     * 生成面向用户的摘要
     * 只列出前几条错误，其余按数量汇总
     *
     * @return 摘要文本
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Exported ").append(successCount).append(" image(s)");
        if (errorCount == 0) {
            return sb.toString();
        }
        sb.append(", failed ").append(errorCount).append(" image(s)");
        if (!errors.isEmpty()) {
            sb.append("\n\nErrors:");
            errors.stream().limit(MAX_SUMMARY_ERRORS).forEach(e -> sb.append('\n').append(e));
            if (errors.size() > MAX_SUMMARY_ERRORS) {
                sb.append("\n... and ").append(errors.size() - MAX_SUMMARY_ERRORS).append(" more error(s)");
            }
        }
        return sb.toString();
    }

    /**
     * 批次开始时创建的空结果收集器，只在导出线程内使用
     */
    public static Collector collector() {
        return new Collector();
    }

    /**
     * 结果收集器
     * 每个任务完成后追加一次，最后一个任务完成后调用 {@link #finish()} 生成结果
     */
    public static final class Collector {

        private int successCount;

        private final List<String> errors = new ArrayList<>();

        private Collector() {
        }

        public void recordSuccess() {
            successCount++;
        }

        public void recordFailure(String filename, String message) {
            errors.add(filename + ": " + message);
        }

        public int attempted() {
            return successCount + errors.size();
        }

        public ExportResult finish() {
            return new ExportResult(successCount, errors.size(), errors);
        }
    }
}

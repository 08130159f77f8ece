package com.timxs.photowatermark.service;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ExportValidationException;
import com.timxs.photowatermark.model.ExportProgress;
import com.timxs.photowatermark.model.ExportResult;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * 批量导出接口
 */
public interface ExportService {

    /**
     * 在后台导出线程中执行批量导出
     * 校验失败时返回 {@link ExportValidationException} 错误，且不会写入任何文件；
     * 取消订阅后不再开始新的文件
     *
     * @param inputs       输入图片
     * @param outputFolder 输出目录
     * @param settings     导出设置快照
     * @param listener     进度监听（在导出线程中回调）
     * @return 导出结果（异步）
     */
    Mono<ExportResult> export(List<Path> inputs, Path outputFolder, ExportSettings settings,
                              Consumer<ExportProgress> listener);

    /**
     * 在当前线程中同步执行批量导出，按输入顺序逐个处理
     * 单个文件失败只记入结果，不会中断批次
     *
     * @param inputs       输入图片
     * @param outputFolder 输出目录
     * @param settings     导出设置快照
     * @param listener     进度监听
     * @return 导出结果
     * @throws ExportValidationException 前置校验失败时抛出
     */
    ExportResult run(List<Path> inputs, Path outputFolder, ExportSettings settings,
                     Consumer<ExportProgress> listener);

    /**
     * 前置校验：输出目录必须存在，且不能与任何源图片所在目录相同
     *
     * @param inputs       输入图片
     * @param outputFolder 输出目录
     * @throws ExportValidationException 校验失败时抛出
     */
    void validate(List<Path> inputs, Path outputFolder);
}

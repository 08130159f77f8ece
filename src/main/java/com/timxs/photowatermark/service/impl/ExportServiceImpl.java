package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.exception.ExportValidationException;
import com.timxs.photowatermark.model.ExportJob;
import com.timxs.photowatermark.model.ExportProgress;
import com.timxs.photowatermark.model.ExportResult;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.service.ExportService;
import com.timxs.photowatermark.service.FontResolver;
import com.timxs.photowatermark.service.FormatConverter;
import com.timxs.photowatermark.service.WatermarkService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 批量导出实现
 * 处理顺序：校验 -> 逐个文件（读取 -> 合成水印 -> 命名 -> 编码写出 -> 进度通知）
 * 整个批次在单个后台线程中顺序执行
 */
@Slf4j
@Service
public class ExportServiceImpl implements ExportService {

    /**
     * 水印合成
     */
    private final WatermarkService watermarkService;

    /**
     * 图片编解码
     */
    private final FormatConverter formatConverter;

    /**
     * 字体解析，与预览共用
     */
    private final FontResolver fontResolver;

    /**
     * 导出专用的单线程调度器
     */
    private final Scheduler exportScheduler;

    public ExportServiceImpl(WatermarkService watermarkService, FormatConverter formatConverter,
                             FontResolver fontResolver, @Qualifier("exportScheduler") Scheduler exportScheduler) {
        this.watermarkService = watermarkService;
        this.formatConverter = formatConverter;
        this.fontResolver = fontResolver;
        this.exportScheduler = exportScheduler;
    }

    @Override
    public Mono<ExportResult> export(List<Path> inputs, Path outputFolder, ExportSettings settings,
                                     Consumer<ExportProgress> listener) {
        // 校验在调度前完成，失败时不会开始任何工作
        try {
            validate(inputs, outputFolder);
        } catch (ExportValidationException e) {
            log.warn("导出校验失败: {}", e.getMessage());
            return Mono.error(e);
        }

        List<ExportJob> jobs = plan(inputs, settings);
        return Mono.defer(() -> {
                AtomicBoolean cancelled = new AtomicBoolean(false);
                return Mono.fromCallable(() -> runJobs(jobs, outputFolder, settings, listener, cancelled::get))
                    .doOnCancel(() -> {
                        log.info("导出已取消，当前文件完成后停止");
                        cancelled.set(true);
                    });
            })
            .subscribeOn(exportScheduler);
    }

    @Override
    public ExportResult run(List<Path> inputs, Path outputFolder, ExportSettings settings,
                            Consumer<ExportProgress> listener) {
        validate(inputs, outputFolder);
        return runJobs(plan(inputs, settings), outputFolder, settings, listener, () -> false);
    }

    @Override
    public void validate(List<Path> inputs, Path outputFolder) {
        if (outputFolder == null) {
            throw new ExportValidationException("Output folder is not specified");
        }
        if (!Files.isDirectory(outputFolder)) {
            throw new ExportValidationException("Output folder does not exist: " + outputFolder);
        }

        Path canonicalOutput = canonical(outputFolder);
        for (Path input : inputs == null ? List.<Path>of() : inputs) {
            Path parent = input.toAbsolutePath().getParent();
            if (parent != null && canonical(parent).equals(canonicalOutput)) {
                throw new ExportValidationException(
                    "Cannot export into the source folder, choose another output folder: " + outputFolder);
            }
        }
    }

    /**
     * 为每个输入文件创建任务，共享同一份设置快照
     */
    private List<ExportJob> plan(List<Path> inputs, ExportSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Export settings cannot be null");
        }
        List<ExportJob> jobs = new ArrayList<>();
        if (inputs != null) {
            for (Path input : inputs) {
                jobs.add(new ExportJob(input, settings));
            }
        }
        return List.copyOf(jobs);
    }

    /**
     * 顺序执行任务
     * 单个文件的失败只记入结果；取消标记在两个文件之间检查
     */
    private ExportResult runJobs(List<ExportJob> jobs, Path outputFolder, ExportSettings settings,
                                 Consumer<ExportProgress> listener, BooleanSupplier cancelled) {
        log.info("开始导出 {} 张图片到 {}，格式: {}", jobs.size(), outputFolder, settings.format());
        long start = System.currentTimeMillis();

        // 整个批次只解析一次字体，所有文件使用同一个字形来源
        ResolvedFont font = fontResolver.resolveFor(settings.watermark(), settings.resolvedFontSource())
            .orElse(null);

        ExportResult.Collector collector = ExportResult.collector();
        int total = jobs.size();
        for (int i = 0; i < total; i++) {
            if (cancelled.getAsBoolean()) {
                log.info("导出已取消，已处理 {}/{}", collector.attempted(), total);
                break;
            }
            ExportJob job = jobs.get(i);
            String filename = job.filename();
            try {
                Path target = exportOne(job, font, outputFolder);
                collector.recordSuccess();
                log.debug("导出成功: {} -> {}", filename, target.getFileName());
            } catch (IOException e) {
                log.error("导出失败: {} - {}", filename, e.getMessage());
                collector.recordFailure(filename, e.getMessage());
            } catch (RuntimeException e) {
                log.error("导出发生错误: {}", filename, e);
                collector.recordFailure(filename, e.getClass().getSimpleName() + " - " + e.getMessage());
            }
            notifyProgress(listener, new ExportProgress(i + 1, total, filename));
        }

        ExportResult result = collector.finish();
        log.info("导出完成: 成功 {}，失败 {}，耗时 {} ms",
            result.successCount(), result.errorCount(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * 导出单个文件，源图片只在本方法内持有
     */
    private Path exportOne(ExportJob job, ResolvedFont font, Path outputFolder) throws IOException {
        ExportSettings settings = job.settings();
        BufferedImage image = formatConverter.read(job.source());
        BufferedImage watermarked = watermarkService.render(image, settings.watermark(), font, settings.margin());

        String outputFilename = formatConverter.outputFilename(job.filename(), settings);
        Path target = outputFolder.resolve(outputFilename);
        formatConverter.write(watermarked, settings.format(), settings.quality(), target);
        return target;
    }

    private void notifyProgress(Consumer<ExportProgress> listener, ExportProgress progress) {
        if (listener == null) {
            return;
        }
        try {
            listener.accept(progress);
        } catch (RuntimeException e) {
            log.warn("进度回调异常: {}", e.getMessage());
        }
    }

    private Path canonical(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }
}

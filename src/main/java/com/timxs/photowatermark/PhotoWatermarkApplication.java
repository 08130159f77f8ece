package com.timxs.photowatermark;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.timxs.photowatermark.config.ExportSettings;
import com.timxs.photowatermark.config.PhotoWatermarkConfiguration;
import com.timxs.photowatermark.config.StudioConfig;
import com.timxs.photowatermark.exception.ExportValidationException;
import com.timxs.photowatermark.model.ExportResult;
import com.timxs.photowatermark.service.ExportService;
import com.timxs.photowatermark.service.SettingsManager;
import com.timxs.photowatermark.service.TemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 批量水印命令行入口
 * 用法：[--settings 配置文件] [--template 模板名] --output 输出目录 图片...
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@Slf4j
public class PhotoWatermarkApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED_FILES = 1;
    static final int EXIT_INVALID = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * 执行一次批量导出
     *
     * @param args 命令行参数
     * @return 退出码：0 全部成功，1 部分文件失败，2 参数或校验错误
     */
    static int run(String[] args) {
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            log.error("Usage: [--settings <file>] [--template <name>] --output <dir> <image>...");
            return EXIT_INVALID;
        }

        log.info("Photo Watermark 启动中...");
        try (AnnotationConfigApplicationContext context = createContext(arguments.settingsFile())) {
            StudioConfig config = context.getBean(StudioConfig.class);

            if (arguments.template() != null) {
                TemplateStore templateStore = context.getBean(TemplateStore.class);
                Optional<ObjectNode> template = templateStore.get(arguments.template());
                if (template.isEmpty()) {
                    log.error("模板不存在: {}，可用模板: {}", arguments.template(), templateStore.list());
                    return EXIT_INVALID;
                }
                context.getBean(SettingsManager.class).applyBag(config, template.get());
                log.info("已应用模板: {}", arguments.template());
            }

            ExportSettings settings = ExportSettings.snapshot(config);
            ExportService exportService = context.getBean(ExportService.class);

            ExportResult result = exportService.export(arguments.images(), arguments.outputFolder(), settings,
                    progress -> log.info("[{}/{}] {}", progress.current(), progress.total(), progress.filename()))
                .block();

            if (result == null) {
                return EXIT_INVALID;
            }
            log.info("{}", result.summary());
            return result.hasErrors() ? EXIT_FAILED_FILES : EXIT_OK;
        } catch (ExportValidationException e) {
            log.error("导出未开始: {}", e.getMessage());
            return EXIT_INVALID;
        } finally {
            log.info("Photo Watermark 已停止");
        }
    }

    private static AnnotationConfigApplicationContext createContext(Path settingsFile) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
        if (settingsFile != null) {
            Map<String, Object> properties = new HashMap<>();
            properties.put(PhotoWatermarkConfiguration.SETTINGS_PROPERTY, settingsFile.toString());
            context.getEnvironment().getPropertySources()
                .addFirst(new MapPropertySource("commandLine", properties));
        }
        context.register(PhotoWatermarkConfiguration.class);
        context.refresh();
        return context;
    }

    /**
     * 命令行参数
     */
    record Arguments(Path settingsFile, String template, Path outputFolder, List<Path> images) {

        static Arguments parse(String[] args) {
            Path settingsFile = null;
            String template = null;
            Path outputFolder = null;
            List<Path> images = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--settings" -> settingsFile = Path.of(value(args, ++i, arg));
                    case "--template" -> template = value(args, ++i, arg);
                    case "--output" -> outputFolder = Path.of(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        images.add(Path.of(arg));
                    }
                }
            }

            if (outputFolder == null) {
                throw new IllegalArgumentException("Output folder is not specified");
            }
            if (images.isEmpty()) {
                throw new IllegalArgumentException("No input images");
            }
            return new Arguments(settingsFile, template, outputFolder, List.copyOf(images));
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length || args[index].isBlank()) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }
    }
}

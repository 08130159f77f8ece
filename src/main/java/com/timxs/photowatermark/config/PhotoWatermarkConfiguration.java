package com.timxs.photowatermark.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.timxs.photowatermark.service.SettingsManager;
import com.timxs.photowatermark.service.TemplateStore;
import com.timxs.photowatermark.service.impl.JsonFileTemplateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring 配置
 * 扫描服务组件，并声明共享的配置、字体目录、模板存储和导出调度器
 */
@Slf4j
@Configuration
@ComponentScan("com.timxs.photowatermark")
public class PhotoWatermarkConfiguration {

    /**
     * 外部配置文件路径的属性名
     */
    public static final String SETTINGS_PROPERTY = "photo-watermark.settings";

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 工作台配置，启动时加载一次
     */
    @Bean
    public StudioConfig studioConfig(SettingsManager settingsManager, Environment environment) {
        String settingsFile = environment.getProperty(SETTINGS_PROPERTY);
        Path path = settingsFile == null || settingsFile.isBlank() ? null : Path.of(settingsFile);
        StudioConfig config = settingsManager.getConfig(path).block();
        return config != null ? config : new StudioConfig();
    }

    @Bean
    public FontCatalog fontCatalog(StudioConfig studioConfig) {
        List<Path> directories = studioConfig.getFontDirectories().stream()
            .map(Path::of)
            .toList();
        FontCatalog catalog = FontCatalog.defaults(directories);
        log.debug("字体目录: {}", catalog.fontDirectories());
        return catalog;
    }

    @Bean
    public TemplateStore templateStore(ObjectMapper objectMapper, StudioConfig studioConfig) {
        return new JsonFileTemplateStore(objectMapper, Path.of(studioConfig.getTemplateFile()));
    }

    /**
     * 导出专用调度器
     * 单线程，批次内的文件按顺序处理
     */
    @Bean(name = "exportScheduler", destroyMethod = "dispose")
    public Scheduler exportScheduler() {
        return Schedulers.newSingle("watermark-export");
    }
}

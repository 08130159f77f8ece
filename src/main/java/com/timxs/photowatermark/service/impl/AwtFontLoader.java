package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.service.FontLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 字形来源加载器实现
 * 使用 Java AWT 加载字体文件，同一文件只加载一次
 */
@Slf4j
@Service
public class AwtFontLoader implements FontLoader {

    /**
     * 已加载的字体文件，键为规范化后的绝对路径
     */
    private final Map<Path, Font> loadedFonts = new ConcurrentHashMap<>();

    @Override
    public Optional<Font> load(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        Path key = file.toAbsolutePath().normalize();
        Font cached = loadedFonts.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            // TTC 字体集合包含多个字体，取第一个
            Font[] fonts = Font.createFonts(key.toFile());
            if (fonts.length == 0) {
                log.warn("字体文件中没有字体: {}", key);
                return Optional.empty();
            }
            Font font = loadedFonts.computeIfAbsent(key, k -> fonts[0].deriveFont(1f));
            log.debug("字体加载成功: {} -> {}", key, font.getFontName());
            return Optional.of(font);
        } catch (FontFormatException | IOException e) {
            log.warn("字体文件加载失败: {} - {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<Font> byFamilyName(String family) {
        if (family == null || family.isBlank()) {
            return Optional.empty();
        }
        try {
            String[] installed = GraphicsEnvironment.getLocalGraphicsEnvironment().getAvailableFontFamilyNames();
            for (String name : installed) {
                if (name.equalsIgnoreCase(family.trim())) {
                    return Optional.of(new Font(name, Font.PLAIN, 1));
                }
            }
        } catch (RuntimeException e) {
            log.warn("无法列出系统字体: {}", e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public Font defaultFont() {
        return new Font(Font.SANS_SERIF, Font.PLAIN, 1);
    }
}

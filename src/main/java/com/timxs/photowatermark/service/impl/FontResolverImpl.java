package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.FontCatalog;
import com.timxs.photowatermark.config.TextWatermarkConfig;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.model.WatermarkDescriptor;
import com.timxs.photowatermark.model.WatermarkType;
import com.timxs.photowatermark.service.FontLoader;
import com.timxs.photowatermark.service.FontResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Font;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 字体解析器实现
 * 按字体表查找字形文件，结果按 (字体族, 粗体, 斜体, 是否含中日韩字符) 缓存，
 * 预览和导出因此总是拿到同一个字形来源
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FontResolverImpl implements FontResolver {

    /**
     * 字体表
     */
    private final FontCatalog fontCatalog;

    /**
     * 字体文件加载器
     */
    private final FontLoader fontLoader;

    /**
     * 已解析的字形来源
     */
    private final Map<FontKey, Selection> cache = new ConcurrentHashMap<>();

    @Override
    public ResolvedFont resolve(String family, int size, boolean bold, boolean italic, String sampleText) {
        FontKey key = new FontKey(family, bold, italic, containsCjk(sampleText));
        Selection selection = cache.computeIfAbsent(key, this::select);
        return selection.derive(size);
    }

    @Override
    public ResolvedFont fromSource(Path source, String family, int size, boolean bold, boolean italic,
                                   String sampleText) {
        if (source == null) {
            return resolve(family, size, bold, italic, sampleText);
        }
        Optional<Font> font = fontLoader.load(source);
        if (font.isEmpty()) {
            log.warn("预览解析的字体文件不可用: {}，重新解析字体", source);
            return resolve(family, size, bold, italic, sampleText);
        }

        String fileName = source.getFileName() == null ? "" : source.getFileName().toString();
        boolean realBold;
        boolean realItalic;
        Optional<FontCatalog.VariantSelection> known = fontCatalog.findByFile(fileName);
        if (known.isPresent()) {
            realBold = known.get().realBold();
            realItalic = known.get().realItalic();
        } else {
            // 不在字体表中时按文件名判断
            String name = fileName.toLowerCase(Locale.ROOT);
            realBold = name.contains("bd") || name.contains("bold");
            realItalic = name.contains("i.") || name.contains("italic") || name.contains("bi");
        }
        return new Selection(font.get(), source, realBold, realItalic).derive(size);
    }

    @Override
    public Optional<ResolvedFont> resolveFor(WatermarkDescriptor descriptor, Path resolvedSource) {
        if (descriptor == null || descriptor.type() != WatermarkType.TEXT) {
            return Optional.empty();
        }
        TextWatermarkConfig text = (TextWatermarkConfig) descriptor;
        return Optional.of(fromSource(resolvedSource, text.fontFamily(), text.fontSize(),
            text.bold(), text.italic(), text.content()));
    }

    @Override
    public List<String> searchOrder(String family, String sampleText) {
        return searchOrder(family, containsCjk(sampleText));
    }

    private List<String> searchOrder(String family, boolean cjk) {
        List<String> order = new ArrayList<>();
        if (cjk) {
            order.addAll(fontCatalog.cjkFallbacks());
        }
        if (family != null && !order.contains(family)) {
            order.add(family);
        }
        return order;
    }

    /**
     * 是否包含中日韩统一表意文字（基本区、扩展 A、扩展 B）
     *
     * @param text 文字
     * @return 是否包含
     */
    public static boolean containsCjk(String text) {
        if (text == null) {
            return false;
        }
        return text.codePoints().anyMatch(code ->
            (code >= 0x4E00 && code <= 0x9FFF)
                || (code >= 0x3400 && code <= 0x4DBF)
                || (code >= 0x20000 && code <= 0x2A6DF));
    }

    /**
     * 按尝试顺序查找第一个存在的字形文件
     */
    private Selection select(FontKey key) {
        Set<Path> tried = new HashSet<>();
        for (String family : searchOrder(key.family(), key.cjk())) {
            Optional<FontCatalog.FontVariants> variants = fontCatalog.variants(family);
            if (variants.isEmpty()) {
                continue;
            }
            FontCatalog.VariantSelection variant = variants.get().select(key.bold(), key.italic());
            if (variant.fileName() == null) {
                continue;
            }
            for (Path path : fontCatalog.candidatePaths(variant.fileName())) {
                if (!tried.add(path) || !Files.exists(path)) {
                    continue;
                }
                Optional<Font> font = fontLoader.load(path);
                if (font.isPresent()) {
                    log.debug("字体解析: {} (bold={}, italic={}, cjk={}) -> {}",
                        key.family(), key.bold(), key.italic(), key.cjk(), path);
                    return new Selection(font.get(), path, variant.realBold(), variant.realItalic());
                }
            }
        }

        // 字体表中没有可用文件时，尝试把字体族当作字体文件路径或系统字体名称
        Optional<Path> directFile = asFontFile(key.family());
        if (directFile.isPresent()) {
            Optional<Font> font = fontLoader.load(directFile.get());
            if (font.isPresent()) {
                return new Selection(font.get(), directFile.get(), false, false);
            }
        }
        Optional<Font> installed = fontLoader.byFamilyName(key.family());
        if (installed.isPresent()) {
            log.debug("字体解析: {} -> 系统字体 {}", key.family(), installed.get().getFamily());
            return new Selection(installed.get(), null, false, false);
        }

        log.warn("未找到字体 {}，使用默认字体", key.family());
        return new Selection(fontLoader.defaultFont(), null, false, false);
    }

    private Optional<Path> asFontFile(String family) {
        if (family == null || family.isBlank()) {
            return Optional.empty();
        }
        try {
            Path path = Path.of(family);
            return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    /**
     * 缓存键
     */
    private record FontKey(String family, boolean bold, boolean italic, boolean cjk) {
    }

    /**
     * 选中的字形来源（1px 基准字体）
     */
    private record Selection(Font baseFont, Path source, boolean realBold, boolean realItalic) {

        ResolvedFont derive(int size) {
            return new ResolvedFont(baseFont.deriveFont((float) Math.max(1, size)), source, realBold, realItalic);
        }
    }
}

package com.timxs.photowatermark.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 字体目录表
 * 字体族到字形文件（常规/粗体/斜体/粗斜体）的静态映射，以及含中日韩文字时优先尝试的字体族
 */
public final class FontCatalog {

    /**
     * 含中日韩文字时按顺序优先尝试的字体族
     */
    public static final List<String> DEFAULT_CJK_FALLBACKS = List.of("Microsoft YaHei", "SimSun", "SimHei");

    private final Map<String, FontVariants> families;

    private final List<String> cjkFallbacks;

    private final List<Path> fontDirectories;

    public FontCatalog(Map<String, FontVariants> families, List<String> cjkFallbacks, List<Path> fontDirectories) {
        this.families = Collections.unmodifiableMap(new LinkedHashMap<>(families));
        this.cjkFallbacks = List.copyOf(cjkFallbacks);
        this.fontDirectories = List.copyOf(fontDirectories);
    }

    /**
     * 默认字体表，字体文件从给定目录查找
     *
     * @param fontDirectories 字体目录，为空时使用系统字体目录
     */
    public static FontCatalog defaults(List<Path> fontDirectories) {
        Map<String, FontVariants> families = new LinkedHashMap<>();
        families.put("Microsoft YaHei", new FontVariants("msyh.ttc", "msyhbd.ttc", null, null));
        families.put("SimSun", new FontVariants("simsun.ttc", null, null, null));
        families.put("SimHei", new FontVariants("simhei.ttf", null, null, null));
        families.put("Arial", new FontVariants("arial.ttf", "arialbd.ttf", "ariali.ttf", "arialbi.ttf"));
        families.put("Times New Roman", new FontVariants("times.ttf", "timesbd.ttf", "timesi.ttf", "timesbi.ttf"));
        List<Path> dirs = fontDirectories == null || fontDirectories.isEmpty()
            ? List.of(systemFontDirectory())
            : fontDirectories;
        return new FontCatalog(families, DEFAULT_CJK_FALLBACKS, dirs);
    }

    /**
     * 系统字体目录：%WINDIR%\Fonts
     */
    public static Path systemFontDirectory() {
        String windir = System.getenv("WINDIR");
        return Path.of(windir == null || windir.isBlank() ? "C:\\Windows" : windir, "Fonts");
    }

    public Optional<FontVariants> variants(String family) {
        return Optional.ofNullable(family == null ? null : families.get(family));
    }

    public List<String> cjkFallbacks() {
        return cjkFallbacks;
    }

    public List<Path> fontDirectories() {
        return fontDirectories;
    }

    /**
     * 在字体目录中查找字体文件的候选路径（按目录顺序）
     */
    public List<Path> candidatePaths(String fileName) {
        List<Path> paths = new ArrayList<>(fontDirectories.size());
        for (Path dir : fontDirectories) {
            paths.add(dir.resolve(fileName));
        }
        return paths;
    }

    /**
     * 根据文件名反查它在字体表中对应的样式
     *
     * @param fileName 字体文件名（不区分大小写）
     * @return 样式选择结果，不在表中时为空
     */
    public Optional<VariantSelection> findByFile(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        for (FontVariants variants : families.values()) {
            Optional<VariantSelection> match = variants.match(fileName);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * 一个字体族的字形文件
     *
     * @param regular    常规
     * @param bold       粗体（可为 null）
     * @param italic     斜体（可为 null）
     * @param boldItalic 粗斜体（可为 null）
     */
    public record FontVariants(String regular, String bold, String italic, String boldItalic) {

        /**
         * 按请求的样式选择字形文件
         * 粗斜体 > 粗体 > 斜体 > 常规，缺少对应文件时退回下一级
         *
         * @param wantBold   是否请求粗体
         * @param wantItalic 是否请求斜体
         * @return 选择结果
         */
        public VariantSelection select(boolean wantBold, boolean wantItalic) {
            if (wantBold && wantItalic && boldItalic != null) {
                return new VariantSelection(boldItalic, true, true);
            }
            if (wantBold && bold != null) {
                return new VariantSelection(bold, true, false);
            }
            if (wantItalic && italic != null) {
                return new VariantSelection(italic, false, true);
            }
            return new VariantSelection(regular, false, false);
        }

        Optional<VariantSelection> match(String fileName) {
            if (fileName.equalsIgnoreCase(boldItalic)) {
                return Optional.of(new VariantSelection(boldItalic, true, true));
            }
            if (fileName.equalsIgnoreCase(bold)) {
                return Optional.of(new VariantSelection(bold, true, false));
            }
            if (fileName.equalsIgnoreCase(italic)) {
                return Optional.of(new VariantSelection(italic, false, true));
            }
            if (fileName.equalsIgnoreCase(regular)) {
                return Optional.of(new VariantSelection(regular, false, false));
            }
            return Optional.empty();
        }
    }

    /**
     * 样式选择结果
     *
     * @param fileName   字体文件名（可为 null，表示该字体族没有可用文件）
     * @param realBold   是否为真实粗体
     * @param realItalic 是否为真实斜体
     */
    public record VariantSelection(String fileName, boolean realBold, boolean realItalic) {
    }
}

package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.config.FontCatalog;
import com.timxs.photowatermark.config.ImageWatermarkConfig;
import com.timxs.photowatermark.config.TextWatermarkConfig;
import com.timxs.photowatermark.config.WatermarkConfig;
import com.timxs.photowatermark.model.PixelSize;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.service.FontLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.Font;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FontResolverImplTest {

    @Mock
    FontLoader fontLoader;

    @TempDir
    Path fontDir;

    FontResolverImpl resolver;

    private final Font baseFont = new Font(Font.SANS_SERIF, Font.PLAIN, 1);

    @BeforeEach
    void setUp() {
        resolver = new FontResolverImpl(FontCatalog.defaults(List.of(fontDir)), fontLoader);
    }

    @Test
    void cjkTextPrefersCjkFamilies() throws IOException {
        Path yahei = fontFile("msyh.ttc");
        fontFile("arial.ttf");
        when(fontLoader.load(any(Path.class))).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.resolve("Arial", 24, false, false, "版权所有 2024");

        assertEquals(yahei, font.source());
        assertEquals(24, font.size());
    }

    @Test
    void cjkFallbackSkipsMissingFiles() throws IOException {
        Path simsun = fontFile("simsun.ttc");
        when(fontLoader.load(simsun)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.resolve("Arial", 24, false, false, "水印");

        assertEquals(simsun, font.source());
    }

    @Test
    void latinTextUsesRequestedFamilyAndVariant() throws IOException {
        fontFile("msyh.ttc");
        fontFile("arial.ttf");
        Path arialBold = fontFile("arialbd.ttf");
        when(fontLoader.load(arialBold)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.resolve("Arial", 32, true, false, "Copyright");

        assertEquals(arialBold, font.source());
        assertTrue(font.realBold());
        assertFalse(font.needsPseudoBold(true));
    }

    @Test
    void familyWithoutBoldFileNeedsPseudoBold() throws IOException {
        Path simsun = fontFile("simsun.ttc");
        when(fontLoader.load(simsun)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.resolve("SimSun", 24, true, false, "abc");

        assertEquals(simsun, font.source());
        assertFalse(font.realBold());
        assertTrue(font.needsPseudoBold(true));
    }

    @Test
    void sameKeyResolvesToSameSourceOnce() throws IOException {
        Path arial = fontFile("arial.ttf");
        when(fontLoader.load(arial)).thenReturn(Optional.of(baseFont));

        ResolvedFont preview = resolver.resolve("Arial", 24, false, false, "Hello");
        ResolvedFont export = resolver.resolve("Arial", 48, false, false, "World");

        assertEquals(preview.source(), export.source());
        assertEquals(48, export.size());
        verify(fontLoader, times(1)).load(arial);
    }

    @Test
    void unknownFamilyFallsBackToDefaultFont() {
        when(fontLoader.byFamilyName("No Such Font")).thenReturn(Optional.empty());
        when(fontLoader.defaultFont()).thenReturn(baseFont);

        ResolvedFont font = resolver.resolve("No Such Font", 20, true, true, "abc");

        assertNull(font.source());
        assertEquals(20, font.size());
        assertTrue(font.needsPseudoBold(true));
        verify(fontLoader, never()).load(any(Path.class));
    }

    @Test
    void installedFamilyIsUsedWhenNotInCatalog() {
        when(fontLoader.byFamilyName("DejaVu Sans")).thenReturn(Optional.of(new Font("DejaVu Sans", Font.PLAIN, 1)));

        ResolvedFont font = resolver.resolve("DejaVu Sans", 18, false, false, "abc");

        assertNull(font.source());
        assertEquals("DejaVu Sans", font.font().getName());
        verify(fontLoader, never()).defaultFont();
    }

    @Test
    void fromSourceReusesPreviewFile() throws IOException {
        Path arialBold = fontFile("arialbd.ttf");
        when(fontLoader.load(arialBold)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.fromSource(arialBold, "SimSun", 30, true, false, "水印");

        assertEquals(arialBold, font.source());
        assertTrue(font.realBold());
        assertEquals(30, font.size());
    }

    @Test
    void fromSourceGuessesStyleFromUnknownFileName() throws IOException {
        Path custom = fontFile("MyFont-BoldItalic.otf");
        when(fontLoader.load(custom)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.fromSource(custom, "MyFont", 30, true, true, "abc");

        assertTrue(font.realBold());
        assertTrue(font.realItalic());
    }

    @Test
    void fromSourceFallsBackWhenFileIsGone() throws IOException {
        Path arial = fontFile("arial.ttf");
        Path missing = fontDir.resolve("deleted.ttf");
        when(fontLoader.load(missing)).thenReturn(Optional.empty());
        when(fontLoader.load(arial)).thenReturn(Optional.of(baseFont));

        ResolvedFont font = resolver.fromSource(missing, "Arial", 24, false, false, "abc");

        assertEquals(arial, font.source());
    }

    @Test
    void resolveForTextAndImageDescriptors() throws IOException {
        Path arial = fontFile("arial.ttf");
        when(fontLoader.load(arial)).thenReturn(Optional.of(baseFont));
        WatermarkConfig config = new WatermarkConfig();
        config.setFontFamily("Arial");
        config.setText("Sample");
        config.setFontSize(40);

        Optional<ResolvedFont> text = resolver.resolveFor(
            TextWatermarkConfig.from(config, new PixelSize(400, 300)), null);
        Optional<ResolvedFont> image = resolver.resolveFor(
            new ImageWatermarkConfig(null, null, Placement.anchored(null), 70, 0), null);

        assertTrue(text.isPresent());
        assertEquals(40, text.get().size());
        assertTrue(image.isEmpty());
    }

    @Test
    void searchOrderPutsCjkFallbacksFirst() {
        assertEquals(List.of("Microsoft YaHei", "SimSun", "SimHei", "Arial"), resolver.searchOrder("Arial", "水印"));
        assertEquals(List.of("Microsoft YaHei", "SimSun", "SimHei"), resolver.searchOrder("SimSun", "水印"));
        assertEquals(List.of("Arial"), resolver.searchOrder("Arial", "Hello"));
        verifyNoInteractions(fontLoader);
    }

    @Test
    void detectsCjkCharacters() {
        assertTrue(FontResolverImpl.containsCjk("abc中"));
        assertTrue(FontResolverImpl.containsCjk("㐀"));
        assertTrue(FontResolverImpl.containsCjk(new String(Character.toChars(0x20000))));
        assertFalse(FontResolverImpl.containsCjk("こんにちは"));
        assertFalse(FontResolverImpl.containsCjk(null));
    }

    private Path fontFile(String name) throws IOException {
        return Files.write(fontDir.resolve(name), new byte[]{0, 1, 0, 0});
    }
}

package com.timxs.photowatermark.service.impl;

import com.timxs.photowatermark.TestImages;
import com.timxs.photowatermark.config.ImageWatermarkConfig;
import com.timxs.photowatermark.config.TextWatermarkConfig;
import com.timxs.photowatermark.model.PixelPoint;
import com.timxs.photowatermark.model.Placement;
import com.timxs.photowatermark.model.ResolvedFont;
import com.timxs.photowatermark.model.WatermarkPosition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.Font;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class WatermarkServiceImplTest {

    private static final int WHITE = 0xFFFFFFFF;

    private final WatermarkServiceImpl watermarkService =
        new WatermarkServiceImpl(new PositionMapperImpl(), new FormatConverterImpl());

    @TempDir
    Path tempDir;

    @Test
    void pseudoBoldOnlyWithoutRealBoldFace() {
        Font font = new Font(Font.SANS_SERIF, Font.PLAIN, 24);
        ResolvedFont regularOnly = new ResolvedFont(font, null, false, false);
        ResolvedFont realBold = new ResolvedFont(font, null, true, false);

        assertEquals(List.of(new PixelPoint(0, 0), new PixelPoint(1, 0), new PixelPoint(0, 1), new PixelPoint(1, 1)),
            WatermarkServiceImpl.glyphPassOffsets(true, regularOnly));
        assertEquals(1, WatermarkServiceImpl.glyphPassOffsets(true, realBold).size());
        assertEquals(1, WatermarkServiceImpl.glyphPassOffsets(false, regularOnly).size());
    }

    @Test
    void imageWatermarkOpacityMultipliesAlpha() throws IOException {
        Path logo = TestImages.writePng(tempDir.resolve("logo.png"),
            TestImages.solid(10, 10, 0xFFFF0000, BufferedImage.TYPE_INT_ARGB));
        BufferedImage photo = TestImages.solid(100, 80, WHITE, BufferedImage.TYPE_INT_RGB);
        ImageWatermarkConfig config = new ImageWatermarkConfig(logo, null,
            Placement.anchored(WatermarkPosition.TOP_LEFT), 50, 0);

        BufferedImage result = watermarkService.render(photo, config, null, 20);

        // alpha = 255 * 50 / 100 = 127，以自身 alpha 为蒙版粘贴后为 63，再按 over 合成到白底
        assertEquals(new Color(223, 192, 192, 255), new Color(result.getRGB(20, 20), true));
        assertEquals(new Color(223, 192, 192, 255), new Color(result.getRGB(29, 29), true));
        assertEquals(WHITE, result.getRGB(19, 19));
        assertEquals(WHITE, result.getRGB(30, 30));
    }

    @Test
    void multiplyAlphaTruncates() {
        BufferedImage image = TestImages.solid(2, 2, 0xFFFF0000, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(1, 1, 0x01FF0000);

        WatermarkServiceImpl.multiplyAlpha(image, 50);

        assertEquals(0x7FFF0000, image.getRGB(0, 0));
        assertEquals(0x00FF0000, image.getRGB(1, 1));
    }

    @Test
    void opaqueImageWatermarkAtBottomRight() throws IOException {
        Path logo = TestImages.writePng(tempDir.resolve("logo.png"),
            TestImages.solid(10, 10, 0xFF0000FF, BufferedImage.TYPE_INT_ARGB));
        BufferedImage photo = TestImages.solid(100, 80, WHITE, BufferedImage.TYPE_INT_RGB);
        ImageWatermarkConfig config = new ImageWatermarkConfig(logo, null,
            Placement.anchored(WatermarkPosition.BOTTOM_RIGHT), 100, 0);

        BufferedImage result = watermarkService.render(photo, config, null, 5);

        assertEquals(0xFF0000FF, result.getRGB(85, 65));
        assertEquals(0xFF0000FF, result.getRGB(94, 74));
        assertEquals(WHITE, result.getRGB(95, 75));
    }

    @Test
    void imageWatermarkScalePercent() throws IOException {
        Path logo = TestImages.writePng(tempDir.resolve("logo.png"),
            TestImages.solid(20, 20, 0xFF00FF00, BufferedImage.TYPE_INT_ARGB));
        BufferedImage photo = TestImages.solid(100, 80, WHITE, BufferedImage.TYPE_INT_RGB);
        ImageWatermarkConfig config = new ImageWatermarkConfig(logo, 50,
            Placement.anchored(WatermarkPosition.TOP_LEFT), 100, 0);

        BufferedImage result = watermarkService.render(photo, config, null, 0);

        assertEquals(0xFF00FF00, result.getRGB(5, 5));
        assertEquals(WHITE, result.getRGB(15, 15));
    }

    @Test
    void renderDoesNotModifyInput() throws IOException {
        Path logo = TestImages.writePng(tempDir.resolve("logo.png"),
            TestImages.solid(10, 10, 0xFF000000, BufferedImage.TYPE_INT_ARGB));
        BufferedImage photo = TestImages.solid(60, 40, 0xFF336699, BufferedImage.TYPE_INT_RGB);
        int[] before = TestImages.pixels(photo);

        BufferedImage result = watermarkService.render(photo,
            new ImageWatermarkConfig(logo, null, Placement.anchored(WatermarkPosition.MIDDLE_CENTER), 100, 0),
            null, 20);

        assertArrayEquals(before, TestImages.pixels(photo));
        assertEquals(BufferedImage.TYPE_INT_ARGB, result.getType());
        assertNotEquals(photo.getRGB(30, 20), result.getRGB(30, 20));
    }

    @Test
    void missingWatermarkImageLeavesPhotoUnchanged() {
        BufferedImage photo = TestImages.solid(60, 40, 0xFF336699, BufferedImage.TYPE_INT_RGB);
        ImageWatermarkConfig config = new ImageWatermarkConfig(tempDir.resolve("missing.png"), null,
            Placement.anchored(null), 70, 0);

        BufferedImage result = watermarkService.render(photo, config, null, 20);

        assertArrayEquals(TestImages.pixels(photo), TestImages.pixels(result));
    }

    @Test
    void emptyTextDrawsNothing() {
        BufferedImage photo = TestImages.solid(60, 40, 0xFF336699, BufferedImage.TYPE_INT_RGB);
        TextWatermarkConfig config = text("", false, false);

        BufferedImage result = watermarkService.render(photo, config, null, 20);

        assertArrayEquals(TestImages.pixels(photo), TestImages.pixels(result));
    }

    @Test
    void textWithoutFontIsRejected() {
        BufferedImage photo = TestImages.solid(60, 40, WHITE, BufferedImage.TYPE_INT_RGB);

        assertThrows(IllegalArgumentException.class,
            () -> watermarkService.render(photo, text("abc", false, false), null, 20));
        assertThrows(IllegalArgumentException.class,
            () -> watermarkService.render(null, text("abc", false, false), null, 20));
    }

    @Test
    void textIsDrawnNearAnchor() {
        assumeTrue(fontsAvailable(), "no fonts available in this environment");
        BufferedImage photo = TestImages.solid(400, 200, 0xFF000000, BufferedImage.TYPE_INT_RGB);
        ResolvedFont font = new ResolvedFont(new Font(Font.SANS_SERIF, Font.PLAIN, 40), null, false, false);

        BufferedImage result = watermarkService.render(photo, text("WWWW", true, true), font, 10);

        int changedTopLeft = 0;
        for (int y = 0; y < 100; y++) {
            for (int x = 0; x < 200; x++) {
                if (result.getRGB(x, y) != 0xFF000000) {
                    changedTopLeft++;
                }
            }
        }
        assertNotEquals(0, changedTopLeft);
        assertEquals(0xFF000000, result.getRGB(399, 199));
    }

    @Test
    void pseudoBoldKeepsTextOpacity() {
        assumeTrue(fontsAvailable(), "no fonts available in this environment");
        BufferedImage photo = TestImages.solid(400, 200, 0xFF000000, BufferedImage.TYPE_INT_RGB);
        ResolvedFont font = new ResolvedFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80), null, false, false);

        // alpha = round(255 * 50 / 100) = 128，白色叠在黑底上为 128
        for (boolean bold : new boolean[]{false, true}) {
            for (boolean shadow : new boolean[]{false, true}) {
                TextWatermarkConfig config = new TextWatermarkConfig("IIII", "SansSerif", 80, bold, false, shadow,
                    Color.WHITE, Placement.anchored(WatermarkPosition.TOP_LEFT), 50, 0);

                BufferedImage result = watermarkService.render(photo, config, font, 10);

                assertEquals(128, maxRed(result), "bold=" + bold + ", shadow=" + shadow);
            }
        }
    }

    @Test
    void shadowIsOffsetWithHalfAlphaBehindText() {
        assumeTrue(fontsAvailable(), "no fonts available in this environment");
        BufferedImage photo = TestImages.solid(400, 200, WHITE, BufferedImage.TYPE_INT_RGB);
        ResolvedFont font = new ResolvedFont(new Font(Font.SANS_SERIF, Font.PLAIN, 80), null, false, false);
        Color red = new Color(255, 0, 0);

        BufferedImage plain = watermarkService.render(photo, redText(red, false, 0), font, 10);
        BufferedImage shadowed = watermarkService.render(photo, redText(red, true, 0), font, 10);

        // 文字 alpha 128：(255, 127, 127)；阴影 alpha 64 的黑色：(191, 191, 191)
        int textInside = 0xFFFF7F7F;
        int shadowOnly = 0xFFBFBFBF;
        int overlapped = 0;
        int shadowVisible = 0;
        for (int y = 2; y < photo.getHeight(); y++) {
            for (int x = 2; x < photo.getWidth(); x++) {
                if (plain.getRGB(x - 2, y - 2) != textInside) {
                    continue;
                }
                // 阴影内部：文字本身在此处时覆盖阴影，否则显示阴影
                if (plain.getRGB(x, y) == textInside) {
                    assertEquals(textInside, shadowed.getRGB(x, y), "text over shadow at " + x + "," + y);
                    overlapped++;
                } else if (plain.getRGB(x, y) == WHITE) {
                    assertEquals(shadowOnly, shadowed.getRGB(x, y), "shadow at " + x + "," + y);
                    shadowVisible++;
                }
            }
        }
        assertTrue(overlapped > 0);
        assertTrue(shadowVisible > 0);

        int minGreen = 255;
        for (int argb : TestImages.pixels(shadowed)) {
            minGreen = Math.min(minGreen, (argb >> 8) & 0xFF);
        }
        assertTrue(minGreen >= 126, "text blended over shadow: min green " + minGreen);
    }

    @Test
    void textRotatesAboutBoxCentre() {
        assumeTrue(fontsAvailable(), "no fonts available in this environment");
        BufferedImage photo = TestImages.solid(400, 400, 0xFF000000, BufferedImage.TYPE_INT_RGB);
        ResolvedFont font = new ResolvedFont(new Font(Font.SANS_SERIF, Font.PLAIN, 40), null, false, false);

        int[] upright = changedBounds(watermarkService.render(photo,
            new TextWatermarkConfig("HHHH", "SansSerif", 40, false, false, false, Color.WHITE,
                Placement.anchored(WatermarkPosition.MIDDLE_CENTER), 100, 0), font, 10), 0xFF000000);
        int[] turned = changedBounds(watermarkService.render(photo,
            new TextWatermarkConfig("HHHH", "SansSerif", 40, false, false, false, Color.WHITE,
                Placement.anchored(WatermarkPosition.MIDDLE_CENTER), 100, 90), font, 10), 0xFF000000);

        int uprightWidth = upright[2] - upright[0];
        int uprightHeight = upright[3] - upright[1];
        int turnedWidth = turned[2] - turned[0];
        int turnedHeight = turned[3] - turned[1];
        assertTrue(uprightWidth > uprightHeight);
        assertTrue(Math.abs(turnedWidth - uprightHeight) <= 3, "width " + turnedWidth);
        assertTrue(Math.abs(turnedHeight - uprightWidth) <= 3, "height " + turnedHeight);
        // 中心不变
        assertTrue(Math.abs((turned[0] + turned[2]) - (upright[0] + upright[2])) <= 6);
        assertTrue(Math.abs((turned[1] + turned[3]) - (upright[1] + upright[3])) <= 6);
    }

    @Test
    void imageRotationIsCounterClockwiseOnExpandedCanvas() throws IOException {
        // 左半红色，右半蓝色
        BufferedImage source = TestImages.solid(20, 10, 0xFFFF0000, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 10; y++) {
            for (int x = 10; x < 20; x++) {
                source.setRGB(x, y, 0xFF0000FF);
            }
        }
        Path logo = TestImages.writePng(tempDir.resolve("logo.png"), source);
        BufferedImage photo = TestImages.solid(100, 80, WHITE, BufferedImage.TYPE_INT_RGB);

        BufferedImage topLeft = watermarkService.render(photo, new ImageWatermarkConfig(logo, null,
            Placement.anchored(WatermarkPosition.TOP_LEFT), 100, 90), null, 0);

        // 逆时针 90 度后为 10x20，右半部分转到上方
        assertEquals(0xFF0000FF, topLeft.getRGB(5, 4));
        assertEquals(0xFFFF0000, topLeft.getRGB(5, 15));
        assertEquals(WHITE, topLeft.getRGB(15, 5));
        assertEquals(WHITE, topLeft.getRGB(5, 25));

        BufferedImage bottomRight = watermarkService.render(photo, new ImageWatermarkConfig(logo, null,
            Placement.anchored(WatermarkPosition.BOTTOM_RIGHT), 100, 90), null, 0);

        // 按旋转后的尺寸定位：左上角在 (90, 60)
        assertEquals(0xFF0000FF, bottomRight.getRGB(95, 64));
        assertEquals(0xFFFF0000, bottomRight.getRGB(95, 75));
        assertEquals(WHITE, bottomRight.getRGB(85, 75));
    }

    private TextWatermarkConfig text(String content, boolean bold, boolean shadow) {
        return new TextWatermarkConfig(content, "Arial", 40, bold, false, shadow, Color.WHITE,
            Placement.anchored(WatermarkPosition.TOP_LEFT), 100, 0);
    }

    private TextWatermarkConfig redText(Color color, boolean shadow, double rotation) {
        return new TextWatermarkConfig("IIII", "SansSerif", 80, false, false, shadow, color,
            Placement.anchored(WatermarkPosition.TOP_LEFT), 50, rotation);
    }

    private static int maxRed(BufferedImage image) {
        int max = 0;
        for (int argb : TestImages.pixels(image)) {
            max = Math.max(max, (argb >> 16) & 0xFF);
        }
        return max;
    }

    /**
     * 与背景色不同的像素范围：{minX, minY, maxX, maxY}
     */
    private static int[] changedBounds(BufferedImage image, int background) {
        int[] bounds = {Integer.MAX_VALUE, Integer.MAX_VALUE, -1, -1};
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                if (image.getRGB(x, y) != background) {
                    bounds[0] = Math.min(bounds[0], x);
                    bounds[1] = Math.min(bounds[1], y);
                    bounds[2] = Math.max(bounds[2], x);
                    bounds[3] = Math.max(bounds[3], y);
                }
            }
        }
        assertTrue(bounds[2] >= 0, "nothing drawn");
        return bounds;
    }

    private static boolean fontsAvailable() {
        try {
            BufferedImage scratch = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
            scratch.createGraphics().getFontMetrics(new Font(Font.SANS_SERIF, Font.PLAIN, 12)).stringWidth("A");
            return true;
        } catch (Throwable e) {
            return false;
        }
    }
}

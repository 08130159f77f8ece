package com.timxs.photowatermark.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NamingRuleTest {

    @Test
    void applyNamingRules() {
        assertEquals("photo.jpg", NamingRule.ORIGINAL.apply("photo", ".jpg", "wm_", "_wm"));
        assertEquals("wm_photo.jpg", NamingRule.PREFIX.apply("photo", ".jpg", "wm_", "_wm"));
        assertEquals("photo_wm.png", NamingRule.SUFFIX.apply("photo", ".png", "wm_", "_wm"));
        assertEquals("photo.png", NamingRule.SUFFIX.apply("photo", ".png", null, null));
    }

    @Test
    void parseRuleAndFormatNames() {
        assertEquals(NamingRule.PREFIX, NamingRule.fromKey("prefix"));
        assertEquals(NamingRule.SUFFIX, NamingRule.fromKey("SUFFIX"));
        assertEquals(NamingRule.ORIGINAL, NamingRule.fromKey("unknown"));

        assertEquals(OutputFormat.JPEG, OutputFormat.fromName("jpg"));
        assertEquals(OutputFormat.JPEG, OutputFormat.fromName(".JPEG"));
        assertEquals(OutputFormat.PNG, OutputFormat.fromName("png"));
        assertEquals(".jpg", OutputFormat.JPEG.getExtension());
    }
}

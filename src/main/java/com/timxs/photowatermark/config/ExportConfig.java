package com.timxs.photowatermark.config;

import com.timxs.photowatermark.model.NamingRule;
import com.timxs.photowatermark.model.OutputFormat;
import lombok.Data;

/**
 * 导出配置
 * 控制输出格式、质量和文件命名
 */
@Data
public class ExportConfig {

    /**
     * 输出格式
     */
    private OutputFormat format = OutputFormat.JPEG;

    /**
     * 输出质量（1-100，仅 JPEG 有效）
     */
    private int quality = 95;

    /**
     * 命名规则
     */
    private NamingRule namingRule = NamingRule.ORIGINAL;

    /**
     * 前缀（PREFIX 规则使用）
     */
    private String prefix = "wm_";

    /**
     * 后缀（SUFFIX 规则使用）
     */
    private String suffix = "_watermarked";
}

package com.example.formstructure.util.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.regex.Pattern;

/**
 * 表格布局推断配置类
 *
 * 硬编码默认值，支持从 JSON 文件部分覆盖，失败时回退默认值。
 */
public class TableLayoutConfig {

    private static final Logger log = LoggerFactory.getLogger(TableLayoutConfig.class);

    /** 行聚类的 y 坐标容差（px） */
    public double ROW_TOLERANCE_PX = 5.0;

    /** 首列（行头）的 x 坐标上限（px） */
    public double LEFT_MARGIN_PX = 200.0;

    /** 行号格式：数字或数字加句点 */
    public String NUMBERED_ROW_PATTERN = "^\\d+\\.?$";

    /** 无法推断时的兜底文本 */
    public String UNKNOWN_FIELD_LABEL = "Unknown field";

    /** 加载时编译一次，之后只读 */
    private Pattern numberedRowPattern = Pattern.compile(NUMBERED_ROW_PATTERN);

    private TableLayoutConfig() {
    }

    public Pattern getNumberedRowPattern() {
        return numberedRowPattern;
    }

    /**
     * 加载默认配置
     */
    public static TableLayoutConfig loadDefault() {
        return new TableLayoutConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static TableLayoutConfig loadFromJson(String jsonPath) {
        TableLayoutConfig config = new TableLayoutConfig();

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode json = mapper.readTree(new File(jsonPath));

            if (json.has("ROW_TOLERANCE_PX")) {
                config.ROW_TOLERANCE_PX = json.get("ROW_TOLERANCE_PX").asDouble();
            }
            if (json.has("LEFT_MARGIN_PX")) {
                config.LEFT_MARGIN_PX = json.get("LEFT_MARGIN_PX").asDouble();
            }
            if (json.has("NUMBERED_ROW_PATTERN")) {
                config.NUMBERED_ROW_PATTERN = json.get("NUMBERED_ROW_PATTERN").asText();
                // 非法正则直接回退
                config.numberedRowPattern = Pattern.compile(config.NUMBERED_ROW_PATTERN);
            }
            if (json.has("UNKNOWN_FIELD_LABEL")) {
                config.UNKNOWN_FIELD_LABEL = json.get("UNKNOWN_FIELD_LABEL").asText();
            }

            log.info("[TableLayoutConfig] Loaded config from: {}", jsonPath);

        } catch (Exception e) {
            log.warn("[TableLayoutConfig] Failed to load JSON, using default config: {}", e.getMessage());
            return new TableLayoutConfig();
        }

        return config;
    }

    @Override
    public String toString() {
        return "TableLayoutConfig{ROW_TOLERANCE_PX=" + ROW_TOLERANCE_PX
                + ", LEFT_MARGIN_PX=" + LEFT_MARGIN_PX
                + ", NUMBERED_ROW_PATTERN=" + NUMBERED_ROW_PATTERN
                + ", UNKNOWN_FIELD_LABEL=" + UNKNOWN_FIELD_LABEL + "}";
    }
}

package com.example.formstructure.util.containment;

import com.example.formstructure.util.structure.dto.DetectionClass;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 包含判定全局配置类
 *
 * 设计原则：
 * 1. 硬编码默认值（开箱即用，即基线规则表）
 * 2. 支持从 JSON 文件部分覆盖
 * 3. 容错回退（JSON 解析失败时使用默认值）
 *
 * 规则表按顺序匹配，第一条命中类别对的规则生效；都不命中时使用默认重叠阈值。
 * 重新标定阈值属于策略变更，只改配置不改判定流程。
 */
public class ContainmentConfig {

    private static final Logger log = LoggerFactory.getLogger(ContainmentConfig.class);

    // ========== 规则名称 ==========

    public static final String TABLE_IN_CONTAINER = "table_in_container";
    public static final String FIELD_IN_TABLE = "field_in_table";
    public static final String CHECKBOX_IN_CONTEXT = "checkbox_in_context";
    public static final String OPTION_IN_CONTEXT = "option_in_context";
    public static final String CHECKBOX_IN_OPTION = "checkbox_in_option";
    public static final String CONTEXT_IN_SECTION = "context_in_section";

    // ========== 默认规则 ==========

    /** 默认重叠比例阈值（重叠面积 / 元素面积） */
    public double DEFAULT_THRESHOLD = 0.8;

    // ========== 表格归属 ==========

    /** 水平重叠比例下限（重叠宽度 / min(表格宽, 容器宽)） */
    public double TABLE_HORIZONTAL_OVERLAP_RATIO = 0.2;

    /** 表格内字段：中心点落在表格内也算包含 */
    public boolean TABLE_CENTER_FALLBACK = true;

    // ========== 复选框 ==========

    /** 复选框与选项的匹配策略 */
    public CheckboxMatchStrategy CHECKBOX_MATCH_STRATEGY = CheckboxMatchStrategy.OVERLAP;

    /** ALIGNMENT 策略：中心点 Y 差值上限（px） */
    public double CHECKBOX_ALIGN_Y_PX = 20.0;

    /** ALIGNMENT 策略：复选框右边缘允许越过选项左边缘的距离（px） */
    public double CHECKBOX_ALIGN_BUFFER_PX = 30.0;

    /** 有序规则表 */
    private final List<ContainmentRule> rules = new ArrayList<>();

    /**
     * 私有构造函数（使用工厂方法创建）
     */
    private ContainmentConfig() {
        initDefaultRules();
    }

    /**
     * 初始化基线规则表
     *
     * option_in_context 排在 checkbox_in_context 之后，基线顺序下被前者覆盖。
     */
    private void initDefaultRules() {
        rules.add(new ContainmentRule(TABLE_IN_CONTAINER,
                EnumSet.of(DetectionClass.TABLE), null,
                RuleKind.TABLE_SPAN, 0.3, 100));
        rules.add(new ContainmentRule(FIELD_IN_TABLE,
                EnumSet.of(DetectionClass.FIELD, DetectionClass.CHECKBOX,
                        DetectionClass.CHECKBOX_OPTION, DetectionClass.CHECKBOX_CONTEXT),
                DetectionClass.TABLE,
                RuleKind.MOSTLY_INSIDE, 0.5, 0));
        rules.add(new ContainmentRule(CHECKBOX_IN_CONTEXT,
                EnumSet.of(DetectionClass.CHECKBOX, DetectionClass.CHECKBOX_OPTION),
                DetectionClass.CHECKBOX_CONTEXT,
                RuleKind.OVERLAP_AND_PROXIMITY, 0.1, 100));
        rules.add(new ContainmentRule(OPTION_IN_CONTEXT,
                EnumSet.of(DetectionClass.CHECKBOX_OPTION),
                DetectionClass.CHECKBOX_CONTEXT,
                RuleKind.OVERLAP_AND_PROXIMITY, 0.2, 120));
        rules.add(new ContainmentRule(CHECKBOX_IN_OPTION,
                EnumSet.of(DetectionClass.CHECKBOX),
                DetectionClass.CHECKBOX_OPTION,
                RuleKind.CHECKBOX_IN_OPTION, 0.05, 80));
        rules.add(new ContainmentRule(CONTEXT_IN_SECTION,
                EnumSet.of(DetectionClass.CHECKBOX_CONTEXT),
                DetectionClass.SECTION,
                RuleKind.OVERLAP_AND_PROXIMITY, 0.3, 150));
    }

    /**
     * 查找第一条命中类别对的规则
     *
     * @return 没有命中时返回null（使用默认规则）
     */
    public ContainmentRule findRule(DetectionClass element, DetectionClass container) {
        for (ContainmentRule rule : rules) {
            if (rule.matches(element, container)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * 按名称获取规则
     */
    public ContainmentRule getRule(String name) {
        for (ContainmentRule rule : rules) {
            if (rule.getName().equals(name)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * 获取所有规则（只读，按匹配顺序）
     */
    public List<ContainmentRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * 加载默认配置
     */
    public static ContainmentConfig loadDefault() {
        return new ContainmentConfig();
    }

    /**
     * 从 JSON 文件加载配置（部分覆盖）
     *
     * <pre>
     * {
     *   "DEFAULT_THRESHOLD": 0.8,
     *   "CHECKBOX_MATCH_STRATEGY": "ALIGNMENT",
     *   "rules": {
     *     "checkbox_in_option": {"overlapThreshold": 0.02, "proximityPx": 80}
     *   }
     * }
     * </pre>
     *
     * @param jsonPath JSON 配置文件路径
     * @return 配置对象（失败时返回默认配置）
     */
    public static ContainmentConfig loadFromJson(String jsonPath) {
        ContainmentConfig config = new ContainmentConfig();

        try {
            ObjectMapper mapper = new ObjectMapper();
            JsonNode json = mapper.readTree(new File(jsonPath));
            config.applyOverrides(json);
            log.info("[ContainmentConfig] Loaded config from: {}", jsonPath);
        } catch (Exception e) {
            log.warn("[ContainmentConfig] Failed to load JSON, using default config: {}", e.getMessage());
            return new ContainmentConfig();
        }

        return config;
    }

    private void applyOverrides(JsonNode json) {
        if (json.has("DEFAULT_THRESHOLD")) {
            DEFAULT_THRESHOLD = json.get("DEFAULT_THRESHOLD").asDouble();
        }
        if (json.has("TABLE_HORIZONTAL_OVERLAP_RATIO")) {
            TABLE_HORIZONTAL_OVERLAP_RATIO = json.get("TABLE_HORIZONTAL_OVERLAP_RATIO").asDouble();
        }
        if (json.has("TABLE_CENTER_FALLBACK")) {
            TABLE_CENTER_FALLBACK = json.get("TABLE_CENTER_FALLBACK").asBoolean();
        }
        if (json.has("CHECKBOX_MATCH_STRATEGY")) {
            CHECKBOX_MATCH_STRATEGY = CheckboxMatchStrategy.valueOf(
                    json.get("CHECKBOX_MATCH_STRATEGY").asText().trim().toUpperCase());
        }
        if (json.has("CHECKBOX_ALIGN_Y_PX")) {
            CHECKBOX_ALIGN_Y_PX = json.get("CHECKBOX_ALIGN_Y_PX").asDouble();
        }
        if (json.has("CHECKBOX_ALIGN_BUFFER_PX")) {
            CHECKBOX_ALIGN_BUFFER_PX = json.get("CHECKBOX_ALIGN_BUFFER_PX").asDouble();
        }

        // 覆盖规则阈值
        if (json.has("rules")) {
            JsonNode rulesJson = json.get("rules");
            Iterator<Map.Entry<String, JsonNode>> entries = rulesJson.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                ContainmentRule rule = getRule(entry.getKey());
                if (rule == null) {
                    log.warn("[ContainmentConfig] Unknown rule ignored: {}", entry.getKey());
                    continue;
                }
                JsonNode ruleJson = entry.getValue();
                if (ruleJson.has("overlapThreshold")) {
                    rule.setOverlapThreshold(ruleJson.get("overlapThreshold").asDouble());
                }
                if (ruleJson.has("proximityPx")) {
                    rule.setProximityPx(ruleJson.get("proximityPx").asDouble());
                }
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ContainmentConfig{\n");
        sb.append("  DEFAULT_THRESHOLD=").append(DEFAULT_THRESHOLD).append(",\n");
        sb.append("  TABLE_HORIZONTAL_OVERLAP_RATIO=").append(TABLE_HORIZONTAL_OVERLAP_RATIO).append(",\n");
        sb.append("  TABLE_CENTER_FALLBACK=").append(TABLE_CENTER_FALLBACK).append(",\n");
        sb.append("  CHECKBOX_MATCH_STRATEGY=").append(CHECKBOX_MATCH_STRATEGY).append(",\n");
        sb.append("  rules=").append(rules).append("\n");
        sb.append("}");
        return sb.toString();
    }
}

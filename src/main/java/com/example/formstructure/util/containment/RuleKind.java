package com.example.formstructure.util.containment;

/**
 * 包含规则的判定方式
 */
public enum RuleKind {

    /**
     * 表格归属容器：垂直重叠比例 + 水平重叠比例 + 扩展跨度
     */
    TABLE_SPAN,

    /**
     * 大部分落在容器内：重叠比例超过阈值（可选中心点兜底）
     */
    MOSTLY_INSIDE,

    /**
     * 重叠比例超过阈值且垂直方向接近
     */
    OVERLAP_AND_PROXIMITY,

    /**
     * 复选框归属选项：按 CheckboxMatchStrategy 选择判定方式
     */
    CHECKBOX_IN_OPTION
}

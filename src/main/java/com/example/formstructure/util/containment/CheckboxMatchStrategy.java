package com.example.formstructure.util.containment;

/**
 * 复选框与选项文本的匹配策略
 */
public enum CheckboxMatchStrategy {

    /**
     * 重叠比例 + 垂直接近
     */
    OVERLAP,

    /**
     * 中心点同一水平线 + 复选框在选项文本左侧（复选框图形通常在标签前面）
     */
    ALIGNMENT
}

package com.example.formstructure.util.structure.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 检测类别
 */
public enum DetectionClass {

    /**
     * 文档根节点（合成类别，不来自检测模型）
     */
    DOCUMENT("document"),

    SECTION("section"),

    TABLE("table"),

    FIELD("field"),

    /**
     * 复选框组（题干）
     */
    CHECKBOX_CONTEXT("checkbox_context"),

    /**
     * 复选框选项文本
     */
    CHECKBOX_OPTION("checkbox_option"),

    /**
     * 复选框图形本身
     */
    CHECKBOX("checkbox"),

    TITLE("title");

    private final String value;

    DetectionClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * section / table 的 OCR 文本通常是裁剪不准的噪声
     */
    public boolean isTextSuppressed() {
        return this == SECTION || this == TABLE;
    }

    /**
     * 从字符串解析
     *
     * @return 未知类别返回null（document 不接受作为输入类别）
     */
    public static DetectionClass fromString(String str) {
        if (str == null) {
            return null;
        }
        for (DetectionClass type : values()) {
            if (type != DOCUMENT && type.value.equalsIgnoreCase(str.trim())) {
                return type;
            }
        }
        return null;
    }
}

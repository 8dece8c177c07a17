package com.example.formstructure.util.structure.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 表格布局类型
 */
public enum TableType {

    /**
     * 单表头：一行列头，其余各行重复同样的列结构
     */
    SINGLE_HEADER("single_header"),

    /**
     * 双轴：列头 + 行头共同决定单元格含义
     */
    TWO_AXIS("two_axis"),

    /**
     * 编号行：首列为 1 / 2. / 3 这样的行号
     */
    NUMBERED_ROWS("numbered_rows");

    private final String value;

    TableType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

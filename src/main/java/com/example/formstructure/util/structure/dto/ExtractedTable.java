package com.example.formstructure.util.structure.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * 提取出的表格：表格节点 + 表格内扁平的字段列表
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"text", "confidence", "detection_id", "box", "table_type", "fields", "parent_id"})
public class ExtractedTable {

    private String text;
    private double confidence;

    @JsonProperty("detection_id")
    private String detectionId;

    private String box;

    @JsonProperty("table_type")
    private TableType tableType;  // 仅处理后的表格有值

    private List<TableField> fields = new ArrayList<>();

    @JsonProperty("parent_id")
    private String parentId;  // 最近的 section 祖先，没有时为 ""

    /**
     * 拷贝表格（字段逐个复制）
     */
    public ExtractedTable copy() {
        ExtractedTable copy = new ExtractedTable();
        copy.text = text;
        copy.confidence = confidence;
        copy.detectionId = detectionId;
        copy.box = box;
        copy.tableType = tableType;
        copy.parentId = parentId;
        copy.fields = new ArrayList<>(fields.size());
        for (TableField field : fields) {
            copy.fields.add(field.copy());
        }
        return copy;
    }

    // Getters and Setters
    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    public String getDetectionId() { return detectionId; }
    public void setDetectionId(String detectionId) { this.detectionId = detectionId; }

    public String getBox() { return box; }
    public void setBox(String box) { this.box = box; }

    public TableType getTableType() { return tableType; }
    public void setTableType(TableType tableType) { this.tableType = tableType; }

    public List<TableField> getFields() { return fields; }
    public void setFields(List<TableField> fields) { this.fields = fields; }

    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }
}

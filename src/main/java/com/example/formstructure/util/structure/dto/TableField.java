package com.example.formstructure.util.structure.dto;

import com.example.formstructure.util.geometry.BoundingBox;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 表格内字段（表格提取产物，与树节点解耦的副本）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "text", "box", "confidence"})
public class TableField {

    private String id;
    private DetectionClass type;
    private String text;
    private String box;  // "x y width height"
    private double confidence;

    public TableField() {
    }

    public TableField(String id, DetectionClass type, String text, String box, double confidence) {
        this.id = id;
        this.type = type;
        this.text = text;
        this.box = box;
        this.confidence = confidence;
    }

    public static TableField fromNode(DocumentNode node) {
        return new TableField(node.getId(), node.getType(),
                node.getText() == null ? "" : node.getText(),
                node.getBoxString(), node.getConfidence());
    }

    public TableField copy() {
        return new TableField(id, type, text, box, confidence);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public DetectionClass getType() { return type; }
    public void setType(DetectionClass type) { this.type = type; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getBox() { return box; }
    public void setBox(String box) { this.box = box; }

    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }

    @JsonIgnore
    public BoundingBox getBoundingBox() {
        return BoundingBox.parse(box);
    }
}

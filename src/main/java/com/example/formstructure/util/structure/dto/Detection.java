package com.example.formstructure.util.structure.dto;

import com.example.formstructure.util.geometry.BoundingBox;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 检测结果（上游检测模型 + OCR 的一条记录）
 *
 * 除 text 外不可变；text 只在表格上下文推断或重组文本替换时被改写。
 * JSON 形状与输入一致：detection_id / class / x / y / width / height / confidence / text。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Detection {

    private final String id;
    private final DetectionClass detectionClass;
    private final BoundingBox box;
    private final double confidence;
    private String text;

    private String parentId;  // 可选：产生时已知的父ID
    private String filename;  // 可选：裁剪图片文件名
    private Integer classId;  // 可选：检测模型类别编号

    public Detection(String id, DetectionClass detectionClass, BoundingBox box, double confidence, String text) {
        this.id = id;
        this.detectionClass = detectionClass;
        this.box = box;
        this.confidence = confidence;
        this.text = text == null ? "" : text;
    }

    @JsonProperty("detection_id")
    public String getId() {
        return id;
    }

    @JsonProperty("class")
    public DetectionClass getDetectionClass() {
        return detectionClass;
    }

    @JsonIgnore
    public BoundingBox getBox() {
        return box;
    }

    @JsonProperty("x")
    public double getX() {
        return box.getCenterX();
    }

    @JsonProperty("y")
    public double getY() {
        return box.getCenterY();
    }

    @JsonProperty("width")
    public double getWidth() {
        return box.getWidth();
    }

    @JsonProperty("height")
    public double getHeight() {
        return box.getHeight();
    }

    public double getConfidence() {
        return confidence;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    @JsonProperty("parent_id")
    public String getParentId() {
        return parentId;
    }

    public void setParentId(String parentId) {
        this.parentId = parentId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    @JsonProperty("class_id")
    public Integer getClassId() {
        return classId;
    }

    public void setClassId(Integer classId) {
        this.classId = classId;
    }

    @JsonIgnore
    public double getArea() {
        return box.area();
    }

    @Override
    public String toString() {
        return "Detection{id=" + id + ", class=" + detectionClass.getValue() + ", box=" + box.toBoxString() + "}";
    }
}

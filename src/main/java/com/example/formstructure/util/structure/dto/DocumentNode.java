package com.example.formstructure.util.structure.dto;

import com.example.formstructure.util.geometry.BoundingBox;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 文档树节点
 *
 * 根节点类型为 document，没有检测结果；其余节点包装一个 Detection。
 * 叶子节点的 children 为 null（序列化时不输出 children 键）。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "text", "box", "confidence", "children"})
public class DocumentNode {

    private final Detection detection;
    private final DetectionClass type;
    private String text;
    private List<DocumentNode> children;

    private DocumentNode(Detection detection, DetectionClass type, String text) {
        this.detection = detection;
        this.type = type;
        this.text = text;
    }

    /**
     * 创建文档根节点
     */
    public static DocumentNode root() {
        return new DocumentNode(null, DetectionClass.DOCUMENT, null);
    }

    /**
     * 包装检测结果
     *
     * @param detection 检测结果
     * @param text 节点文本，null 表示不输出 text 键
     */
    public static DocumentNode of(Detection detection, String text) {
        return new DocumentNode(detection, detection.getDetectionClass(), text);
    }

    public String getId() {
        return detection == null ? null : detection.getId();
    }

    public DetectionClass getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @JsonProperty("box")
    public String getBoxString() {
        return detection == null ? null : detection.getBox().toBoxString();
    }

    public Double getConfidence() {
        return detection == null ? null : detection.getConfidence();
    }

    public List<DocumentNode> getChildren() {
        return children;
    }

    @JsonIgnore
    public List<DocumentNode> getChildrenOrEmpty() {
        return children == null ? Collections.<DocumentNode>emptyList() : children;
    }

    public void addChild(DocumentNode child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
    }

    /**
     * 空 children 列表置为 null
     */
    public void compactChildren() {
        if (children != null && children.isEmpty()) {
            children = null;
        }
    }

    @JsonIgnore
    public BoundingBox getBox() {
        return detection == null ? null : detection.getBox();
    }

    @JsonIgnore
    public boolean isRoot() {
        return detection == null;
    }

    /**
     * 深拷贝节点结构（Detection 共享，text 和 children 独立）
     */
    public DocumentNode deepCopy() {
        DocumentNode copy = new DocumentNode(detection, type, text);
        if (children != null) {
            copy.children = new ArrayList<>(children.size());
            for (DocumentNode child : children) {
                copy.children.add(child.deepCopy());
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DocumentNode{type=" + type.getValue() + ", id=" + getId()
                + ", children=" + (children == null ? 0 : children.size()) + "}";
    }
}

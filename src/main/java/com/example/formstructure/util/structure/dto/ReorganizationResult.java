package com.example.formstructure.util.structure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 外部重组器（LLM）的输出
 *
 * structure: sectionId -> 元素ID列表
 * cleaned_text: 元素ID -> 清洗后的文本
 *
 * 两个字段为 null 时按空映射处理。
 */
public class ReorganizationResult {

    private Map<String, List<String>> structure = new LinkedHashMap<>();

    @JsonProperty("cleaned_text")
    private Map<String, String> cleanedText = new LinkedHashMap<>();

    public ReorganizationResult() {
    }

    public ReorganizationResult(Map<String, List<String>> structure, Map<String, String> cleanedText) {
        this.structure = structure == null ? new LinkedHashMap<String, List<String>>() : structure;
        this.cleanedText = cleanedText == null ? new LinkedHashMap<String, String>() : cleanedText;
    }

    public static ReorganizationResult empty() {
        return new ReorganizationResult();
    }

    public Map<String, List<String>> getStructure() { return structure; }
    public void setStructure(Map<String, List<String>> structure) {
        this.structure = structure == null ? new LinkedHashMap<String, List<String>>() : structure;
    }

    public Map<String, String> getCleanedText() { return cleanedText; }
    public void setCleanedText(Map<String, String> cleanedText) {
        this.cleanedText = cleanedText == null ? new LinkedHashMap<String, String>() : cleanedText;
    }
}

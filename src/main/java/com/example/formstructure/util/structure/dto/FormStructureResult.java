package com.example.formstructure.util.structure.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

/**
 * 完整处理流程的结果
 *
 * hierarchy 是合并表格结果之前的快照，final_hierarchy 是合并之后的文档树。
 */
@JsonPropertyOrder({"hierarchy", "extracted_tables", "processed_tables", "final_hierarchy", "warnings", "stats"})
public class FormStructureResult {

    private DocumentNode hierarchy;

    @JsonProperty("extracted_tables")
    private Map<String, ExtractedTable> extractedTables;

    @JsonProperty("processed_tables")
    private Map<String, ExtractedTable> processedTables;

    @JsonProperty("final_hierarchy")
    private DocumentNode finalHierarchy;

    private List<String> warnings;

    private Map<String, Object> stats;

    // Getters and Setters
    public DocumentNode getHierarchy() { return hierarchy; }
    public void setHierarchy(DocumentNode hierarchy) { this.hierarchy = hierarchy; }

    public Map<String, ExtractedTable> getExtractedTables() { return extractedTables; }
    public void setExtractedTables(Map<String, ExtractedTable> extractedTables) { this.extractedTables = extractedTables; }

    public Map<String, ExtractedTable> getProcessedTables() { return processedTables; }
    public void setProcessedTables(Map<String, ExtractedTable> processedTables) { this.processedTables = processedTables; }

    public DocumentNode getFinalHierarchy() { return finalHierarchy; }
    public void setFinalHierarchy(DocumentNode finalHierarchy) { this.finalHierarchy = finalHierarchy; }

    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }

    public Map<String, Object> getStats() { return stats; }
    public void setStats(Map<String, Object> stats) { this.stats = stats; }
}

package com.example.formstructure.util.table;

import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.ExtractedTable;
import com.example.formstructure.util.structure.dto.TableField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从文档树中提取表格
 *
 * 每个 table 节点（不限于 section 的直接子节点）提取为一个 {@link ExtractedTable}：
 * - fields：表格下所有 field / title / checkbox_context 后代，按文档顺序扁平化
 * - parent_id：最近的 section 祖先，没有时为 ""
 *
 * 嵌套在表格里的表格单独提取，其字段不计入外层表格。
 */
public class TableExtractor {

    private static final Logger log = LoggerFactory.getLogger(TableExtractor.class);

    private TableExtractor() {
    }

    /**
     * 提取所有表格
     *
     * @param root 文档根节点
     * @return tableId -> 表格（文档顺序）
     */
    public static Map<String, ExtractedTable> extractTables(DocumentNode root) {
        Map<String, ExtractedTable> tables = new LinkedHashMap<>();
        if (root == null) {
            return tables;
        }
        walk(root, "", tables);
        log.info("表格提取完成: {} 个表格", tables.size());
        return tables;
    }

    private static void walk(DocumentNode node, String sectionId, Map<String, ExtractedTable> tables) {
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            if (child.getType() == DetectionClass.TABLE) {
                tables.put(child.getId(), toTable(child, sectionId));
            }
            String nextSection = child.getType() == DetectionClass.SECTION ? child.getId() : sectionId;
            walk(child, nextSection, tables);
        }
    }

    private static ExtractedTable toTable(DocumentNode tableNode, String sectionId) {
        ExtractedTable table = new ExtractedTable();
        table.setDetectionId(tableNode.getId());
        table.setText(tableNode.getText() == null ? "" : tableNode.getText());
        table.setConfidence(tableNode.getConfidence());
        table.setBox(tableNode.getBoxString());
        table.setParentId(sectionId);
        collectFields(tableNode, table.getFields());
        return table;
    }

    private static void collectFields(DocumentNode node, List<TableField> fields) {
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            if (child.getType() == DetectionClass.TABLE) {
                continue;
            }
            if (isTableField(child.getType())) {
                fields.add(TableField.fromNode(child));
            }
            collectFields(child, fields);
        }
    }

    static boolean isTableField(DetectionClass type) {
        return type == DetectionClass.FIELD || type == DetectionClass.TITLE || type == DetectionClass.CHECKBOX_CONTEXT;
    }
}

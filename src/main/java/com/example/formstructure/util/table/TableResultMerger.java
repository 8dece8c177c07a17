package com.example.formstructure.util.table;

import com.example.formstructure.util.common.TextUtils;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.ExtractedTable;
import com.example.formstructure.util.structure.dto.TableField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 把处理后的表格字段文本合并回文档树
 *
 * 只改写原本为空的节点文本，按字段ID匹配；同一个根节点原地更新后返回。
 * 必须在对应表格的上下文合成完成之后调用。
 */
public class TableResultMerger {

    private static final Logger log = LoggerFactory.getLogger(TableResultMerger.class);

    private TableResultMerger() {
    }

    /**
     * 合并处理结果
     *
     * @param root 文档根节点（原地更新）
     * @param processedTables tableId -> 处理后的表格
     * @return 更新后的根节点
     */
    public static DocumentNode merge(DocumentNode root, Map<String, ExtractedTable> processedTables) {
        int updated = mergeChildren(root, processedTables);
        log.info("表格结果合并完成: 更新字段={}", updated);
        return root;
    }

    private static int mergeChildren(DocumentNode node, Map<String, ExtractedTable> processedTables) {
        int updated = 0;
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            if (child.getType() == DetectionClass.TABLE && processedTables.containsKey(child.getId())) {
                updated += applyTable(child, processedTables.get(child.getId()));
            }
            updated += mergeChildren(child, processedTables);
        }
        return updated;
    }

    private static int applyTable(DocumentNode tableNode, ExtractedTable processed) {
        Map<String, String> texts = new HashMap<>();
        for (TableField field : processed.getFields()) {
            if (!TextUtils.isBlank(field.getText())) {
                texts.put(field.getId(), field.getText());
            }
        }
        return applyTexts(tableNode, texts);
    }

    private static int applyTexts(DocumentNode node, Map<String, String> texts) {
        int updated = 0;
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            if (child.getType() == DetectionClass.TABLE) {
                continue;
            }
            String text = texts.get(child.getId());
            if (text != null && TextUtils.isBlank(child.getText()) && !child.getType().isTextSuppressed()) {
                child.setText(text);
                updated++;
            }
            updated += applyTexts(child, texts);
        }
        return updated;
    }
}

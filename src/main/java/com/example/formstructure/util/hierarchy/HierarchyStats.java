package com.example.formstructure.util.hierarchy;

import com.example.formstructure.util.structure.dto.DocumentNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 文档树统计（用于日志和接口返回）
 */
public class HierarchyStats {

    private HierarchyStats() {
    }

    /**
     * 统计文档树信息
     *
     * @param root 根节点
     * @return total_nodes / max_depth / type_counts
     */
    public static Map<String, Object> of(DocumentNode root) {
        Map<String, Object> stats = new LinkedHashMap<>();
        Map<String, Integer> typeCounts = new TreeMap<>();

        int totalNodes = countNodes(root, typeCounts);
        int maxDepth = getMaxDepth(root, 0);

        stats.put("total_nodes", totalNodes);
        stats.put("max_depth", maxDepth);
        stats.put("type_counts", typeCounts);

        return stats;
    }

    /**
     * 不含根节点的节点数
     */
    private static int countNodes(DocumentNode node, Map<String, Integer> typeCounts) {
        int count = 0;
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            String type = child.getType().getValue();
            Integer current = typeCounts.get(type);
            typeCounts.put(type, current == null ? 1 : current + 1);
            count += 1 + countNodes(child, typeCounts);
        }
        return count;
    }

    private static int getMaxDepth(DocumentNode node, int currentDepth) {
        int maxDepth = currentDepth;
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            maxDepth = Math.max(maxDepth, getMaxDepth(child, currentDepth + 1));
        }
        return maxDepth;
    }
}

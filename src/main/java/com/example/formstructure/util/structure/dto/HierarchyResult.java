package com.example.formstructure.util.structure.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 层级构建结果：文档根节点 + 构建过程中记录的警告（被跳过的检测等）
 */
public class HierarchyResult {

    private final DocumentNode root;
    private final List<String> warnings;

    public HierarchyResult(DocumentNode root, List<String> warnings) {
        this.root = root;
        this.warnings = warnings == null ? new ArrayList<String>() : warnings;
    }

    public DocumentNode getRoot() {
        return root;
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}

package com.example.formstructure.util.structure;

/**
 * 文档结构不变量被破坏（重复ID、缺少根节点等）
 *
 * 调用方决定重试、跳过还是中止整份文档。
 */
public class StructureValidationException extends RuntimeException {

    public StructureValidationException(String message) {
        super(message);
    }
}

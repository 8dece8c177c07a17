package com.example.formstructure.service;

import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.ReorganizationResult;

import java.io.IOException;
import java.util.List;

/**
 * 结构重组器（外部协作方，通常基于大模型）
 *
 * 根据几何层级给出 section -> 元素 的重新分组以及清洗后的文本。
 * 核心逻辑只消费结果，不关心结果如何产生。
 */
public interface StructureReorganizer {

    ReorganizationResult reorganize(DocumentNode hierarchy, List<Detection> detections) throws IOException;
}

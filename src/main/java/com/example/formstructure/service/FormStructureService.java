package com.example.formstructure.service;

import com.example.formstructure.util.hierarchy.HierarchyBuilder;
import com.example.formstructure.util.hierarchy.HierarchyStats;
import com.example.formstructure.util.structure.DetectionParser;
import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.ExtractedTable;
import com.example.formstructure.util.structure.dto.FormStructureResult;
import com.example.formstructure.util.structure.dto.HierarchyResult;
import com.example.formstructure.util.structure.dto.ReorganizationResult;
import com.example.formstructure.util.table.TableExtractor;
import com.example.formstructure.util.table.TableLayoutEngine;
import com.example.formstructure.util.table.TableResultMerger;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * 表单结构处理服务
 *
 * 处理流程：
 * 1. 检测结果 → 文档层级（几何包含关系）
 * 2. 文档层级 → 提取表格
 * 3. 表格 → 布局推断 + 空字段上下文合成
 * 4. 处理结果合并回文档层级
 *
 * 检测、OCR、结构重组是外部协作方，通过接口注入，未配置时对应功能不可用。
 */
@Slf4j
@Service
public class FormStructureService {

    static final String STRUCTURE_FILE = "document_structure.json";
    static final String EXTRACTED_TABLES_FILE = "extracted_tables.json";
    static final String PROCESSED_TABLES_FILE = "processed_tables.json";
    static final String FINAL_STRUCTURE_FILE = "final_structured_document.json";

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final HierarchyBuilder hierarchyBuilder;
    private final TableLayoutEngine tableLayoutEngine;
    private final Optional<DetectionClient> detectionClient;
    private final Optional<OcrClient> ocrClient;
    private final Optional<StructureReorganizer> reorganizer;

    @Autowired
    public FormStructureService(HierarchyBuilder hierarchyBuilder,
                                TableLayoutEngine tableLayoutEngine,
                                Optional<DetectionClient> detectionClient,
                                Optional<OcrClient> ocrClient,
                                Optional<StructureReorganizer> reorganizer) {
        this.hierarchyBuilder = hierarchyBuilder;
        this.tableLayoutEngine = tableLayoutEngine;
        this.detectionClient = detectionClient;
        this.ocrClient = ocrClient;
        this.reorganizer = reorganizer;
    }

    /**
     * 只构建文档层级
     */
    public HierarchyResult buildHierarchy(List<Detection> detections) {
        return hierarchyBuilder.build(detections);
    }

    /**
     * 完整处理流程
     *
     * @param detections 检测结果
     * @return 各阶段产物
     */
    public FormStructureResult process(List<Detection> detections) {
        return process(detections, new ArrayList<String>());
    }

    private FormStructureResult process(List<Detection> detections, List<String> upstreamWarnings) {
        log.info("开始处理表单结构: 检测数={}", detections.size());

        // Step 1: 构建层级
        HierarchyResult hierarchyResult = hierarchyBuilder.build(detections);
        DocumentNode root = hierarchyResult.getRoot();
        DocumentNode snapshot = root.deepCopy();

        // Step 2: 提取表格
        Map<String, ExtractedTable> extractedTables = TableExtractor.extractTables(root);

        // Step 3: 解析表格（合成空字段上下文）
        Map<String, ExtractedTable> processedTables = tableLayoutEngine.processTables(extractedTables);

        // Step 4: 合并回文档树
        DocumentNode finalRoot = TableResultMerger.merge(root, processedTables);

        List<String> warnings = new ArrayList<>(upstreamWarnings);
        warnings.addAll(hierarchyResult.getWarnings());

        Map<String, Object> stats = HierarchyStats.of(finalRoot);
        stats.put("table_count", processedTables.size());
        stats.put("warning_count", warnings.size());
        log.info("表单结构处理完成: {}", stats);

        FormStructureResult result = new FormStructureResult();
        result.setHierarchy(snapshot);
        result.setExtractedTables(extractedTables);
        result.setProcessedTables(processedTables);
        result.setFinalHierarchy(finalRoot);
        result.setWarnings(warnings);
        result.setStats(stats);
        return result;
    }

    /**
     * 解析 JSON 后执行完整流程（解析阶段的警告一并返回）
     *
     * @throws IOException JSON 不合法
     */
    public FormStructureResult processJson(String json) throws IOException {
        DetectionParser.ParseResult parsed = DetectionParser.parse(json);
        return process(parsed.getDetections(), new ArrayList<>(parsed.getWarnings()));
    }

    /**
     * 从整页图片开始：检测 → 逐个 OCR → 完整流程
     *
     * 单个检测 OCR 失败时文本置空并继续。
     *
     * @param image 图片字节
     * @throws IOException 检测服务调用失败
     * @throws IllegalStateException 未配置检测或 OCR 服务
     */
    public FormStructureResult processImage(byte[] image) throws IOException {
        DetectionClient detector = detectionClient.orElseThrow(
                () -> new IllegalStateException("未配置检测服务 DetectionClient"));
        OcrClient ocr = ocrClient.orElseThrow(
                () -> new IllegalStateException("未配置 OCR 服务 OcrClient"));

        List<Detection> detections = detector.detect(image);
        log.info("检测服务返回 {} 个检测结果", detections.size());

        List<String> warnings = new ArrayList<>();
        for (Detection detection : detections) {
            try {
                detection.setText(ocr.recognize(image, detection));
            } catch (IOException | RuntimeException e) {
                String message = String.format("检测 %s OCR 失败: %s", detection.getId(), e.getMessage());
                log.warn(message);
                warnings.add(message);
                detection.setText("");
            }
        }
        return process(detections, warnings);
    }

    /**
     * 使用结构重组器的输出重建层级
     *
     * 未配置重组器或重组器调用失败时返回几何层级。
     */
    public HierarchyResult reorganize(List<Detection> detections) {
        HierarchyResult geometric = hierarchyBuilder.build(detections);
        if (!reorganizer.isPresent()) {
            log.info("未配置结构重组器，返回几何层级");
            return geometric;
        }

        ReorganizationResult reorganization;
        try {
            reorganization = reorganizer.get().reorganize(geometric.getRoot(), detections);
        } catch (IOException e) {
            log.warn("结构重组失败，使用几何层级: {}", e.getMessage());
            return geometric;
        }
        if (reorganization == null) {
            return geometric;
        }
        return hierarchyBuilder.buildFromReorganization(detections, reorganization);
    }

    /**
     * 执行完整流程并把各阶段产物写入任务目录
     *
     * 生成文件：
     * - document_structure.json：初始文档层级
     * - extracted_tables.json：提取的表格
     * - processed_tables.json：处理后的表格
     * - final_structured_document.json：合并后的文档层级
     *
     * @param json 检测结果 JSON
     * @param baseDir 数据根目录
     * @return 包含 taskId、taskDir、stats 的Map
     * @throws IOException 检测结果 JSON 无法解析
     * @throws IllegalStateException 任务目录创建或结果写入失败
     */
    public Map<String, Object> processToDirectory(String json, File baseDir) throws IOException {
        FormStructureResult result = processJson(json);

        String taskId = UUID.randomUUID().toString().replace("-", "");
        File taskDir = new File(baseDir, taskId);
        if (!taskDir.mkdirs()) {
            throw new IllegalStateException("无法创建任务目录: " + taskDir.getAbsolutePath());
        }
        log.info("创建任务目录: {}", taskDir.getAbsolutePath());

        try {
            mapper.writeValue(new File(taskDir, STRUCTURE_FILE), result.getHierarchy());
            mapper.writeValue(new File(taskDir, EXTRACTED_TABLES_FILE), result.getExtractedTables());
            mapper.writeValue(new File(taskDir, PROCESSED_TABLES_FILE), result.getProcessedTables());
            mapper.writeValue(new File(taskDir, FINAL_STRUCTURE_FILE), result.getFinalHierarchy());
        } catch (IOException e) {
            throw new IllegalStateException("写入处理结果失败: " + taskDir.getAbsolutePath(), e);
        }
        log.info("处理结果已写入: {}", taskDir.getAbsolutePath());

        Map<String, Object> output = new HashMap<>();
        output.put("taskId", taskId);
        output.put("taskDir", taskDir.getAbsolutePath());
        output.put("warnings", result.getWarnings());
        output.put("stats", result.getStats());
        return output;
    }
}

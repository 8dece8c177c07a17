package com.example.formstructure.controller;

import com.example.formstructure.service.FormStructureService;
import com.example.formstructure.util.hierarchy.HierarchyStats;
import com.example.formstructure.util.structure.DetectionParser;
import com.example.formstructure.util.structure.StructureValidationException;
import com.example.formstructure.util.structure.dto.FormStructureResult;
import com.example.formstructure.util.structure.dto.HierarchyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 表单结构处理控制器
 *
 * 请求体均为检测结果 JSON 数组（detection_id / class / x / y / width / height / confidence / text）。
 */
@Slf4j
@RestController
@RequestMapping("/api/form-structure")
public class FormStructureController {

    @Autowired
    private FormStructureService formStructureService;

    /**
     * 处理结果根目录
     */
    @Value("${form-structure.output.base-path:/data/form_structure}")
    private String basePath;

    /**
     * 只构建文档层级
     *
     * @param body 检测结果 JSON
     * @return hierarchy / warnings / stats
     */
    @PostMapping(value = "/hierarchy", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> buildHierarchy(@RequestBody String body) {
        Map<String, Object> result = new HashMap<>();
        try {
            DetectionParser.ParseResult parsed = DetectionParser.parse(body);
            HierarchyResult hierarchy = formStructureService.buildHierarchy(parsed.getDetections());

            result.put("success", true);
            result.put("hierarchy", hierarchy.getRoot());
            result.put("warnings", mergeWarnings(parsed.getWarnings(), hierarchy.getWarnings()));
            result.put("stats", HierarchyStats.of(hierarchy.getRoot()));
            return ResponseEntity.ok(result);

        } catch (IOException | StructureValidationException e) {
            return badRequest(result, e);
        } catch (Exception e) {
            return serverError(result, "层级构建失败", e);
        }
    }

    /**
     * 完整处理流程：层级 → 表格提取 → 上下文合成 → 合并
     *
     * @param body 检测结果 JSON
     * @return 各阶段产物
     */
    @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> process(@RequestBody String body) {
        Map<String, Object> result = new HashMap<>();
        try {
            FormStructureResult processed = formStructureService.processJson(body);

            result.put("success", true);
            result.put("result", processed);
            return ResponseEntity.ok(result);

        } catch (IOException | StructureValidationException e) {
            return badRequest(result, e);
        } catch (Exception e) {
            return serverError(result, "处理失败", e);
        }
    }

    /**
     * 上传检测结果文件，处理后把各阶段产物写入任务目录
     *
     * @param file 检测结果 JSON 文件
     * @return taskId / taskDir / stats
     */
    @PostMapping("/process-file")
    public ResponseEntity<Map<String, Object>> processFile(@RequestParam("file") MultipartFile file) {
        Map<String, Object> result = new HashMap<>();

        // 验证文件
        if (file.isEmpty()) {
            result.put("success", false);
            result.put("message", "文件不能为空");
            return ResponseEntity.badRequest().body(result);
        }

        String originalFilename = file.getOriginalFilename();
        if (originalFilename == null || !originalFilename.toLowerCase().endsWith(".json")) {
            result.put("success", false);
            result.put("message", "只支持.json文件");
            return ResponseEntity.badRequest().body(result);
        }

        try {
            log.info("接收文件: {}", originalFilename);
            String json = new String(file.getBytes(), StandardCharsets.UTF_8);
            Map<String, Object> output = formStructureService.processToDirectory(json, new File(basePath));

            result.put("success", true);
            result.putAll(output);
            result.put("originalFilename", originalFilename);
            result.put("message", "处理成功");
            return ResponseEntity.ok(result);

        } catch (IOException | StructureValidationException e) {
            return badRequest(result, e);
        } catch (Exception e) {
            return serverError(result, "处理失败", e);
        }
    }

    /**
     * 使用结构重组器的输出重建层级
     *
     * @param body 检测结果 JSON
     * @return hierarchy / warnings
     */
    @PostMapping(value = "/reorganize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> reorganize(@RequestBody String body) {
        Map<String, Object> result = new HashMap<>();
        try {
            DetectionParser.ParseResult parsed = DetectionParser.parse(body);
            HierarchyResult hierarchy = formStructureService.reorganize(parsed.getDetections());

            result.put("success", true);
            result.put("hierarchy", hierarchy.getRoot());
            result.put("warnings", mergeWarnings(parsed.getWarnings(), hierarchy.getWarnings()));
            return ResponseEntity.ok(result);

        } catch (IOException | StructureValidationException e) {
            return badRequest(result, e);
        } catch (Exception e) {
            return serverError(result, "重组失败", e);
        }
    }

    private static List<String> mergeWarnings(List<String> first, List<String> second) {
        List<String> warnings = new ArrayList<>(first);
        warnings.addAll(second);
        return warnings;
    }

    private static ResponseEntity<Map<String, Object>> badRequest(Map<String, Object> result, Exception e) {
        log.warn("请求数据不合法: {}", e.getMessage());
        result.put("success", false);
        result.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(result);
    }

    private static ResponseEntity<Map<String, Object>> serverError(Map<String, Object> result, String prefix, Exception e) {
        log.error(prefix, e);
        result.put("success", false);
        result.put("message", prefix + ": " + e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
    }
}

package com.example.formstructure.util.structure;

import com.example.formstructure.util.geometry.BoundingBox;
import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 检测结果 JSON 解析器
 *
 * 输入格式：
 * <pre>
 * [
 *   {"detection_id": "...", "class": "field", "x": 100, "y": 60, "width": 20, "height": 10,
 *    "confidence": 0.93, "text": "...", "filename": "...", "parent_id": "..."}
 * ]
 * </pre>
 * 也接受检测服务的包装格式 {"predictions": [...]} 或 {"predictions": {"predictions": [...]}}。
 *
 * 单条记录缺少必需字段时跳过并记录警告，不中止整批解析。
 */
public class DetectionParser {

    private static final Logger log = LoggerFactory.getLogger(DetectionParser.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final String[] GEOMETRY_KEYS = {"x", "y", "width", "height"};

    private DetectionParser() {
    }

    /**
     * 解析结果：有效检测 + 警告
     */
    public static class ParseResult {
        private final List<Detection> detections;
        private final List<String> warnings;

        public ParseResult(List<Detection> detections, List<String> warnings) {
            this.detections = detections;
            this.warnings = warnings;
        }

        public List<Detection> getDetections() {
            return detections;
        }

        public List<String> getWarnings() {
            return Collections.unmodifiableList(warnings);
        }
    }

    /**
     * 从 JSON 字符串解析
     *
     * @throws IOException JSON 不合法或顶层不是数组/包装对象
     */
    public static ParseResult parse(String json) throws IOException {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("检测结果 JSON 解析失败: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    /**
     * 从 JSON 文件解析
     */
    public static ParseResult parse(File jsonFile) throws IOException {
        if (!jsonFile.exists()) {
            throw new IOException("检测结果文件不存在: " + jsonFile.getAbsolutePath());
        }
        return parse(JSON_MAPPER.readTree(jsonFile));
    }

    /**
     * 从已解析的 JSON 树解析
     */
    public static ParseResult parse(JsonNode root) throws IOException {
        JsonNode array = unwrapPredictions(root);
        if (array == null || !array.isArray()) {
            throw new IOException("检测结果必须是 JSON 数组");
        }

        List<Detection> detections = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        int index = 0;
        for (JsonNode record : array) {
            Detection detection = parseRecord(record, index, warnings);
            if (detection != null) {
                detections.add(detection);
            }
            index++;
        }

        log.info("检测结果解析完成: 有效={}, 跳过={}", detections.size(), warnings.size());
        return new ParseResult(detections, warnings);
    }

    private static JsonNode unwrapPredictions(JsonNode root) {
        JsonNode current = root;
        // 检测服务可能返回 {"predictions": {"predictions": [...]}}
        while (current != null && current.isObject() && current.has("predictions")) {
            current = current.get("predictions");
        }
        return current;
    }

    /**
     * 解析单条记录
     *
     * @return 记录不合法时返回null，并在 warnings 中追加原因
     */
    private static Detection parseRecord(JsonNode record, int index, List<String> warnings) {
        if (record == null || !record.isObject()) {
            skip(warnings, String.format("第 %d 条记录不是 JSON 对象", index));
            return null;
        }

        String id = textOrNull(record.get("detection_id"));
        if (id == null || id.isEmpty()) {
            skip(warnings, String.format("第 %d 条记录缺少 detection_id", index));
            return null;
        }

        String classValue = textOrNull(record.get("class"));
        DetectionClass detectionClass = DetectionClass.fromString(classValue);
        if (detectionClass == null) {
            skip(warnings, String.format("检测 %s 的类别未知: %s", id, classValue));
            return null;
        }

        double[] geometry = new double[GEOMETRY_KEYS.length];
        for (int i = 0; i < GEOMETRY_KEYS.length; i++) {
            Double value = numberOrNull(record.get(GEOMETRY_KEYS[i]));
            if (value == null) {
                skip(warnings, String.format("检测 %s 缺少几何字段: %s", id, GEOMETRY_KEYS[i]));
                return null;
            }
            geometry[i] = value;
        }

        Double confidence = numberOrNull(record.get("confidence"));
        String text = textOrNull(record.get("text"));

        Detection detection = new Detection(
                id,
                detectionClass,
                new BoundingBox(geometry[0], geometry[1], geometry[2], geometry[3]),
                confidence == null ? 0 : confidence,
                text);

        String parentId = textOrNull(record.get("parent_id"));
        if (parentId != null && !parentId.isEmpty()) {
            detection.setParentId(parentId);
        }
        detection.setFilename(textOrNull(record.get("filename")));
        JsonNode classId = record.get("class_id");
        if (classId != null && classId.canConvertToInt()) {
            detection.setClassId(classId.asInt());
        }
        return detection;
    }

    private static void skip(List<String> warnings, String message) {
        log.warn("跳过检测记录: {}", message);
        warnings.add(message);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : null;
    }

    /**
     * 数字或数字字符串转 Double
     */
    private static Double numberOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}

package com.example.formstructure.util.hierarchy;

import com.example.formstructure.util.containment.ContainmentClassifier;
import com.example.formstructure.util.structure.DuplicateDetectionException;
import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.HierarchyResult;
import com.example.formstructure.util.structure.dto.ReorganizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 文档层级构建器
 *
 * 功能：
 * - 把扁平的检测列表组装成 document → section → table/checkbox_context → field/checkbox 的有序树
 * - 可选：用外部重组器给出的 section → 元素 映射覆盖几何父子关系
 *
 * 算法：
 * 1. 按面积降序排序（面积大的框更可能是容器）
 * 2. 依次处理每个检测，在已放置的检测中找包含它的面积最小者作为父节点，找不到则挂到根节点
 * 3. 递归按 (y, x) 排序子节点
 * 4. 递归去掉空 children（叶子节点不输出 children 键）
 *
 * 宽或高不为正的检测跳过并记录警告；重复ID直接抛出 {@link DuplicateDetectionException}。
 * 朴素 O(n²) 扫描，单页检测数通常在几十到几百之间。
 */
public class HierarchyBuilder {

    private static final Logger log = LoggerFactory.getLogger(HierarchyBuilder.class);

    /**
     * 阅读顺序：先上后下，同一高度先左后右
     */
    private static final Comparator<DocumentNode> READING_ORDER =
            Comparator.comparingDouble((DocumentNode n) -> n.getBox().getCenterY())
                    .thenComparingDouble(n -> n.getBox().getCenterX());

    private static final Comparator<Detection> AREA_DESC =
            Comparator.comparingDouble(Detection::getArea).reversed();

    private final ContainmentClassifier classifier;

    /**
     * section / table 节点不输出 text
     */
    private final boolean blankContainerText;

    public HierarchyBuilder(ContainmentClassifier classifier) {
        this(classifier, true);
    }

    public HierarchyBuilder(ContainmentClassifier classifier, boolean blankContainerText) {
        this.classifier = classifier;
        this.blankContainerText = blankContainerText;
    }

    /**
     * 构建层级，只返回根节点
     */
    public DocumentNode buildHierarchy(List<Detection> detections) {
        return build(detections).getRoot();
    }

    /**
     * 构建层级
     *
     * @param detections 扁平检测列表
     * @return 根节点 + 警告
     * @throws DuplicateDetectionException 出现重复ID
     */
    public HierarchyResult build(List<Detection> detections) {
        List<String> warnings = new ArrayList<>();
        List<Detection> valid = validate(detections, warnings);
        List<Detection> sorted = sortByAreaDesc(valid);

        Map<String, String> parents = computeParents(sorted);
        DocumentNode root = assemble(sorted, parents, Collections.<String, String>emptyMap());

        log.info("层级构建完成: 输入={}, 放置={}, 跳过={}", detections.size(), sorted.size(), warnings.size());
        return new HierarchyResult(root, warnings);
    }

    /**
     * 以重组器输出作为父子关系和文本的替代来源构建层级
     *
     * 规则：
     * - 先按几何关系算出每个检测的父节点
     * - structure 中列出的元素改挂到对应 section 下（未知ID、非 section 的键、会形成环的边忽略并记录警告）
     * - cleaned_text 替换节点文本（section / table 仍不输出 text）
     *
     * @param detections 扁平检测列表
     * @param reorganization 重组器输出
     * @return 根节点 + 警告
     */
    public HierarchyResult buildFromReorganization(List<Detection> detections, ReorganizationResult reorganization) {
        List<String> warnings = new ArrayList<>();
        List<Detection> valid = validate(detections, warnings);
        List<Detection> sorted = sortByAreaDesc(valid);

        Map<String, Detection> byId = new HashMap<>();
        for (Detection detection : sorted) {
            byId.put(detection.getId(), detection);
        }

        Map<String, String> parents = computeParents(sorted);
        int applied = 0;

        for (Map.Entry<String, List<String>> entry : reorganization.getStructure().entrySet()) {
            String sectionId = entry.getKey();
            if (!byId.containsKey(sectionId)) {
                warn(warnings, "重组结果引用了未知的 section: " + sectionId);
                continue;
            }
            if (byId.get(sectionId).getDetectionClass() != DetectionClass.SECTION) {
                warn(warnings, String.format("重组结果的键 %s 不是 section (%s)，已忽略",
                        sectionId, byId.get(sectionId).getDetectionClass().getValue()));
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            for (String elementId : entry.getValue()) {
                if (!byId.containsKey(elementId)) {
                    warn(warnings, "重组结果引用了未知的元素: " + elementId);
                    continue;
                }
                if (elementId.equals(sectionId)) {
                    continue;
                }
                if (createsCycle(parents, sectionId, elementId)) {
                    warn(warnings, String.format("忽略会形成环的重组边: %s -> %s", sectionId, elementId));
                    continue;
                }
                parents.put(elementId, sectionId);
                applied++;
            }
        }

        Map<String, String> textOverrides = new HashMap<>();
        for (Map.Entry<String, String> entry : reorganization.getCleanedText().entrySet()) {
            if (byId.containsKey(entry.getKey()) && entry.getValue() != null) {
                textOverrides.put(entry.getKey(), entry.getValue());
            }
        }

        DocumentNode root = assemble(sorted, parents, textOverrides);
        log.info("重组层级构建完成: 应用边={}, 替换文本={}, 警告={}", applied, textOverrides.size(), warnings.size());
        return new HierarchyResult(root, warnings);
    }

    /**
     * 校验输入
     *
     * @return 可参与包含判定的检测（保持输入顺序）
     */
    private List<Detection> validate(List<Detection> detections, List<String> warnings) {
        Set<String> seen = new HashSet<>();
        for (Detection detection : detections) {
            if (!seen.add(detection.getId())) {
                throw new DuplicateDetectionException(detection.getId());
            }
        }

        List<Detection> valid = new ArrayList<>(detections.size());
        for (Detection detection : detections) {
            if (!detection.getBox().hasPositiveExtent()) {
                warn(warnings, String.format("检测 %s 的宽或高不为正数 (%s)，已跳过",
                        detection.getId(), detection.getBox().toBoxString()));
                continue;
            }
            valid.add(detection);
        }
        return valid;
    }

    private static List<Detection> sortByAreaDesc(List<Detection> detections) {
        List<Detection> sorted = new ArrayList<>(detections);
        // 稳定排序：面积相同时保持输入顺序
        sorted.sort(AREA_DESC);
        return sorted;
    }

    /**
     * 为每个检测找面积最小的已放置容器
     *
     * @param sorted 按面积降序排列的检测
     * @return detectionId -> 父ID（挂在根节点时为 null）
     */
    private Map<String, String> computeParents(List<Detection> sorted) {
        Map<String, String> parents = new LinkedHashMap<>();
        List<Detection> placed = new ArrayList<>(sorted.size());

        for (Detection detection : sorted) {
            Detection best = null;
            for (Detection candidate : placed) {
                // 面积相同的多个容器取最先放置的
                if ((best == null || candidate.getArea() < best.getArea())
                        && classifier.contains(detection, candidate)) {
                    best = candidate;
                }
            }
            parents.put(detection.getId(), best == null ? null : best.getId());
            if (best != null && log.isDebugEnabled()) {
                log.debug("{} -> {} (rule={})", detection.getId(), best.getId(),
                        classifier.describeRule(detection.getDetectionClass(), best.getDetectionClass()));
            }
            placed.add(detection);
        }
        return parents;
    }

    /**
     * 沿父链向上查找：element 已经是 section 的祖先时，再把 element 挂到 section 下会形成环
     */
    private static boolean createsCycle(Map<String, String> parents, String sectionId, String elementId) {
        String current = sectionId;
        Set<String> visited = new HashSet<>();
        while (current != null && visited.add(current)) {
            if (current.equals(elementId)) {
                return true;
            }
            current = parents.get(current);
        }
        return false;
    }

    /**
     * 根据父子关系创建节点（每个节点只挂载一次），排序并压缩
     */
    private DocumentNode assemble(List<Detection> sorted, Map<String, String> parents, Map<String, String> textOverrides) {
        DocumentNode root = DocumentNode.root();
        Map<String, DocumentNode> nodes = new HashMap<>();

        for (Detection detection : sorted) {
            nodes.put(detection.getId(), DocumentNode.of(detection, nodeText(detection, textOverrides)));
        }

        for (Detection detection : sorted) {
            String parentId = parents.get(detection.getId());
            DocumentNode parent = parentId == null ? root : nodes.get(parentId);
            parent.addChild(nodes.get(detection.getId()));
        }

        sortChildren(root);
        compactChildren(root);
        return root;
    }

    private String nodeText(Detection detection, Map<String, String> textOverrides) {
        if (blankContainerText && detection.getDetectionClass().isTextSuppressed()) {
            return null;
        }
        String override = textOverrides.get(detection.getId());
        return override != null ? override : detection.getText();
    }

    /**
     * 递归按阅读顺序排序子节点（幂等）
     */
    public static void sortChildren(DocumentNode node) {
        if (node.getChildren() == null) {
            return;
        }
        node.getChildren().sort(READING_ORDER);
        for (DocumentNode child : node.getChildren()) {
            sortChildren(child);
        }
    }

    /**
     * 递归去掉空 children 列表
     */
    public static void compactChildren(DocumentNode node) {
        node.compactChildren();
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            compactChildren(child);
        }
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}

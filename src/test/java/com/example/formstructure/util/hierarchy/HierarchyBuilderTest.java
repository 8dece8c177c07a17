package com.example.formstructure.util.hierarchy;

import com.example.formstructure.util.containment.ContainmentClassifier;
import com.example.formstructure.util.containment.ContainmentConfig;
import com.example.formstructure.util.structure.DuplicateDetectionException;
import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.DocumentNode;
import com.example.formstructure.util.structure.dto.HierarchyResult;
import com.example.formstructure.util.structure.dto.ReorganizationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.formstructure.DetectionFixtures.childIds;
import static com.example.formstructure.DetectionFixtures.detection;
import static com.example.formstructure.DetectionFixtures.find;
import static com.example.formstructure.DetectionFixtures.formPage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HierarchyBuilder")
class HierarchyBuilderTest {

    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new HierarchyBuilder(new ContainmentClassifier(ContainmentConfig.loadDefault()));
    }

    @Test
    @DisplayName("字段嵌套在包含它的 section 下")
    void shouldNestFieldUnderSection() {
        List<Detection> detections = Arrays.asList(
                detection("f", DetectionClass.FIELD, 100, 60, 20, 10, "Name"),
                detection("s", DetectionClass.SECTION, 100, 50, 200, 100, "Applicant"));

        DocumentNode root = builder.buildHierarchy(detections);

        assertThat(root.getType()).isEqualTo(DetectionClass.DOCUMENT);
        assertThat(childIds(root)).containsExactly("s");
        DocumentNode section = root.getChildren().get(0);
        assertThat(childIds(section)).containsExactly("f");
        assertThat(section.getChildren().get(0).getChildren()).isNull();
        assertThat(section.getChildren().get(0).getText()).isEqualTo("Name");
    }

    @Test
    @DisplayName("面积相同且不相交的检测都挂在根节点下，按 (y, x) 排序")
    void shouldAttachDisjointEqualBoxesToRoot() {
        List<Detection> detections = Arrays.asList(
                detection("lower", DetectionClass.FIELD, 100, 200, 50, 20),
                detection("right", DetectionClass.FIELD, 300, 100, 50, 20),
                detection("left", DetectionClass.FIELD, 100, 100, 50, 20));

        DocumentNode root = builder.buildHierarchy(detections);

        assertThat(childIds(root)).containsExactly("left", "right", "lower");
    }

    @Test
    @DisplayName("宽度为0的检测被跳过并记录警告")
    void shouldSkipZeroWidthDetectionWithWarning() {
        List<Detection> detections = Arrays.asList(
                detection("s", DetectionClass.SECTION, 100, 50, 200, 100),
                detection("broken", DetectionClass.FIELD, 100, 60, 0, 10),
                detection("f", DetectionClass.FIELD, 100, 60, 20, 10));

        HierarchyResult result = builder.build(detections);

        assertThat(find(result.getRoot(), "broken")).isNull();
        assertThat(find(result.getRoot(), "f")).isNotNull();
        assertThat(result.getWarnings()).hasSize(1);
        assertThat(result.getWarnings().get(0)).contains("broken");
    }

    @Test
    @DisplayName("重复ID直接失败")
    void shouldFailOnDuplicateId() {
        List<Detection> detections = Arrays.asList(
                detection("dup", DetectionClass.FIELD, 100, 60, 20, 10),
                detection("dup", DetectionClass.FIELD, 300, 60, 20, 10));

        assertThatThrownBy(() -> builder.build(detections))
                .isInstanceOf(DuplicateDetectionException.class)
                .hasMessageContaining("dup");
    }

    @Test
    @DisplayName("空输入只得到根节点")
    void shouldReturnBareRootForEmptyInput() {
        DocumentNode root = builder.buildHierarchy(Collections.<Detection>emptyList());

        assertThat(root.isRoot()).isTrue();
        assertThat(root.getChildren()).isNull();
    }

    @Nested
    @DisplayName("整页表单")
    class FormPage {

        private List<Detection> detections;
        private DocumentNode root;

        @BeforeEach
        void build() {
            detections = formPage();
            root = builder.buildHierarchy(detections);
        }

        @Test
        @DisplayName("section → table/checkbox_context → field/option → checkbox")
        void shouldBuildExpectedShape() {
            assertThat(childIds(root)).containsExactly("s1");
            assertThat(childIds(find(root, "s1"))).containsExactly("t1", "c1");
            assertThat(childIds(find(root, "t1")))
                    .containsExactly("h_state", "h_number", "h_exp", "d_state", "d_number", "d_exp");
            assertThat(childIds(find(root, "c1"))).containsExactly("o1");
            assertThat(childIds(find(root, "o1"))).containsExactly("k1");
        }

        @Test
        @DisplayName("每个检测恰好出现一次")
        void shouldPlaceEveryDetectionExactlyOnce() {
            List<String> ids = new ArrayList<>();
            collectIds(root, ids);

            assertThat(ids).hasSize(detections.size());
            assertThat(new HashSet<>(ids)).hasSize(detections.size());
        }

        @Test
        @DisplayName("子节点面积不大于父节点")
        void shouldKeepChildAreaWithinParent() {
            assertAreaInvariant(root);
        }

        @Test
        @DisplayName("不输出空 children")
        void shouldNotLeaveEmptyChildLists() {
            assertNoEmptyChildren(root);
        }

        @Test
        @DisplayName("section 和 table 不输出文本，其它节点保留 OCR 文本")
        void shouldOmitContainerText() {
            assertThat(find(root, "s1").getText()).isNull();
            assertThat(find(root, "t1").getText()).isNull();
            assertThat(find(root, "c1").getText()).isEqualTo("Commercial vehicle?");
            assertThat(find(root, "d_state").getText()).isEmpty();
        }

        @Test
        @DisplayName("重复排序不改变顺序")
        void shouldSortIdempotently() {
            List<String> before = new ArrayList<>();
            collectIds(root, before);

            HierarchyBuilder.sortChildren(root);
            List<String> after = new ArrayList<>();
            collectIds(root, after);

            assertThat(after).isEqualTo(before);
        }

        @Test
        @DisplayName("输入顺序不影响结果")
        void shouldNotDependOnInputOrder() {
            List<Detection> reversed = new ArrayList<>(detections);
            Collections.reverse(reversed);

            List<String> expected = new ArrayList<>();
            collectIds(root, expected);
            List<String> actual = new ArrayList<>();
            collectIds(builder.buildHierarchy(reversed), actual);

            assertThat(actual).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("略微超出 section 底边的 checkbox_context 仍挂在该 section 下")
    void shouldNestContextOverhangingSectionBottom() {
        List<Detection> detections = Arrays.asList(
                detection("s", DetectionClass.SECTION, 500, 500, 1000, 1000),         // y [0, 1000]
                detection("c", DetectionClass.CHECKBOX_CONTEXT, 500, 855, 600, 310),  // y [700, 1010]
                detection("o", DetectionClass.CHECKBOX_OPTION, 500, 900, 200, 40, "Yes"));

        DocumentNode root = builder.buildHierarchy(detections);

        assertThat(childIds(root)).containsExactly("s");
        assertThat(childIds(find(root, "s"))).containsExactly("c");
        assertThat(childIds(find(root, "c"))).containsExactly("o");
    }

    @Test
    @DisplayName("关闭文本隐藏后 section 保留文本")
    void shouldKeepContainerTextWhenConfigured() {
        HierarchyBuilder keepText = new HierarchyBuilder(
                new ContainmentClassifier(ContainmentConfig.loadDefault()), false);

        DocumentNode root = keepText.buildHierarchy(formPage());

        assertThat(find(root, "s1").getText()).isEqualTo("Vehicle Information");
    }

    @Nested
    @DisplayName("buildFromReorganization")
    class FromReorganization {

        private final List<Detection> detections = Arrays.asList(
                detection("s1", DetectionClass.SECTION, 200, 150, 400, 200),
                detection("s2", DetectionClass.SECTION, 200, 450, 400, 200),
                detection("f", DetectionClass.FIELD, 100, 100, 50, 20, "Nmae"),
                detection("g", DetectionClass.FIELD, 100, 400, 50, 20, "Date"));

        @Test
        @DisplayName("重组结果覆盖几何父子关系和文本")
        void shouldOverrideGeometricParentsAndText() {
            Map<String, List<String>> structure = new LinkedHashMap<>();
            structure.put("s2", Arrays.asList("f"));
            Map<String, String> cleaned = new LinkedHashMap<>();
            cleaned.put("f", "Name");

            HierarchyResult result = builder.buildFromReorganization(detections,
                    new ReorganizationResult(structure, cleaned));

            DocumentNode root = result.getRoot();
            assertThat(childIds(find(root, "s1"))).isEmpty();
            assertThat(find(root, "s1").getChildren()).isNull();
            assertThat(childIds(find(root, "s2"))).containsExactly("f", "g");
            assertThat(find(root, "f").getText()).isEqualTo("Name");
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("未知ID和非 section 的键被忽略并记录警告")
        void shouldSkipUnknownIdsAndNonSectionKeys() {
            Map<String, List<String>> structure = new LinkedHashMap<>();
            structure.put("ghost", Arrays.asList("f"));
            structure.put("s1", Arrays.asList("missing"));
            structure.put("f", Arrays.asList("s1"));

            HierarchyResult result = builder.buildFromReorganization(detections,
                    new ReorganizationResult(structure, null));

            DocumentNode root = result.getRoot();
            assertThat(childIds(root)).containsExactly("s1", "s2");
            assertThat(childIds(find(root, "s1"))).containsExactly("f");
            assertThat(result.getWarnings()).hasSize(3);
        }

        @Test
        @DisplayName("section 不会被挂到字段下")
        void shouldNotNestSectionUnderField() {
            Map<String, List<String>> structure = new LinkedHashMap<>();
            structure.put("f", Arrays.asList("s1"));

            HierarchyResult result = builder.buildFromReorganization(detections,
                    new ReorganizationResult(structure, null));

            DocumentNode root = result.getRoot();
            assertThat(childIds(root)).containsExactly("s1", "s2");
            assertThat(childIds(find(root, "s1"))).containsExactly("f");
            assertThat(find(root, "f").getChildren()).isNull();
            assertThat(result.getWarnings()).hasSize(1);
            assertThat(result.getWarnings().get(0)).contains("f");
        }

        @Test
        @DisplayName("section 之间成环的边被忽略并记录警告")
        void shouldSkipCyclicEdgesBetweenSections() {
            Map<String, List<String>> structure = new LinkedHashMap<>();
            structure.put("s1", Arrays.asList("s2"));
            structure.put("s2", Arrays.asList("s1"));

            HierarchyResult result = builder.buildFromReorganization(detections,
                    new ReorganizationResult(structure, null));

            DocumentNode root = result.getRoot();
            assertThat(childIds(root)).containsExactly("s1");
            assertThat(childIds(find(root, "s1"))).containsExactly("f", "s2");
            assertThat(childIds(find(root, "s2"))).containsExactly("g");
            assertThat(result.getWarnings()).hasSize(1);
        }

        @Test
        @DisplayName("structure / cleaned_text 为 null 的 JSON 按空结果处理")
        void shouldTreatNullMapsAsEmpty() throws Exception {
            ReorganizationResult reorganization = new ObjectMapper().readValue(
                    "{\"structure\": null, \"cleaned_text\": null}", ReorganizationResult.class);

            HierarchyResult result = builder.buildFromReorganization(detections, reorganization);

            List<String> geometric = new ArrayList<>();
            collectIds(builder.buildHierarchy(detections), geometric);
            List<String> reorganized = new ArrayList<>();
            collectIds(result.getRoot(), reorganized);
            assertThat(reorganized).isEqualTo(geometric);
            assertThat(result.getWarnings()).isEmpty();
        }

        @Test
        @DisplayName("空重组结果等价于几何层级")
        void shouldMatchGeometricHierarchyForEmptyResult() {
            List<String> geometric = new ArrayList<>();
            collectIds(builder.buildHierarchy(detections), geometric);
            List<String> reorganized = new ArrayList<>();
            collectIds(builder.buildFromReorganization(detections, ReorganizationResult.empty()).getRoot(), reorganized);

            assertThat(reorganized).isEqualTo(geometric);
        }
    }

    private static void collectIds(DocumentNode node, List<String> ids) {
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            ids.add(child.getId());
            collectIds(child, ids);
        }
    }

    private static void assertAreaInvariant(DocumentNode node) {
        for (DocumentNode child : node.getChildrenOrEmpty()) {
            if (!node.isRoot()) {
                assertThat(child.getBox().area())
                        .as("%s inside %s", child.getId(), node.getId())
                        .isLessThanOrEqualTo(node.getBox().area());
            }
            assertAreaInvariant(child);
        }
    }

    private static void assertNoEmptyChildren(DocumentNode node) {
        Set<DocumentNode> visited = new HashSet<>();
        List<DocumentNode> stack = new ArrayList<>();
        stack.add(node);
        while (!stack.isEmpty()) {
            DocumentNode current = stack.remove(stack.size() - 1);
            assertThat(visited.add(current)).isTrue();
            assertThat(current.getChildren() == null || !current.getChildren().isEmpty())
                    .as("children of %s", current.getId())
                    .isTrue();
            stack.addAll(current.getChildrenOrEmpty());
        }
    }
}

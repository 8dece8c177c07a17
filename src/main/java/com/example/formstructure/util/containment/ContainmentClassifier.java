package com.example.formstructure.util.containment;

import com.example.formstructure.util.geometry.BoundingBox;
import com.example.formstructure.util.geometry.GeometryUtils;
import com.example.formstructure.util.structure.dto.Detection;
import com.example.formstructure.util.structure.dto.DetectionClass;

/**
 * 包含关系判定器
 *
 * 判定 element 是否"包含于" container。上游检测框噪声大、不同类别尺寸差异大
 * （复选框图形远小于其标签框），因此按类别对使用不同的重叠/邻近阈值。
 *
 * 该关系不保证对称、传递或反对称。唯一的全局约束：面积大于容器的元素不属于该容器。
 *
 * 规则顺序与阈值见 {@link ContainmentConfig}。
 */
public class ContainmentClassifier {

    private final ContainmentConfig config;

    public ContainmentClassifier(ContainmentConfig config) {
        this.config = config;
    }

    /**
     * 使用配置中的默认阈值判定
     */
    public boolean contains(Detection element, Detection container) {
        return contains(element, container, config.DEFAULT_THRESHOLD);
    }

    /**
     * 判定 element 是否包含于 container
     *
     * @param element 元素
     * @param container 候选容器
     * @param defaultThreshold 未命中任何类别对规则时使用的重叠比例阈值
     * @return true 表示包含
     */
    public boolean contains(Detection element, Detection container, double defaultThreshold) {
        if (element == container) {
            return false;
        }
        BoundingBox e = element.getBox();
        BoundingBox c = container.getBox();
        if (!e.hasPositiveExtent() || !c.hasPositiveExtent()) {
            return false;
        }
        if (e.area() > c.area()) {
            return false;
        }

        ContainmentRule rule = config.findRule(element.getDetectionClass(), container.getDetectionClass());
        if (rule == null) {
            return GeometryUtils.overlapRatio(e, c) > defaultThreshold;
        }

        switch (rule.getKind()) {
            case TABLE_SPAN:
                return tableBelongsTo(e, c, rule);
            case MOSTLY_INSIDE:
                return mostlyInside(e, c, rule);
            case OVERLAP_AND_PROXIMITY:
                return overlapAndClose(e, c, rule);
            case CHECKBOX_IN_OPTION:
                return checkboxBelongsToOption(e, c, rule);
            default:
                return GeometryUtils.overlapRatio(e, c) > defaultThreshold;
        }
    }

    /**
     * 表格归属：
     * 1. 垂直重叠高度 / 表格高度 >= 规则阈值
     * 2. 水平重叠宽度 / min(表格宽, 容器宽) >= TABLE_HORIZONTAL_OVERLAP_RATIO
     * 3. 表格垂直跨度落在容器跨度（上下各扩展 proximityPx）内
     */
    private boolean tableBelongsTo(BoundingBox table, BoundingBox container, ContainmentRule rule) {
        double verticalRatio = GeometryUtils.overlapHeight(table, container) / table.getHeight();
        double horizontalRatio = GeometryUtils.overlapWidth(table, container)
                / Math.min(table.getWidth(), container.getWidth());

        return verticalRatio >= rule.getOverlapThreshold()
                && horizontalRatio >= config.TABLE_HORIZONTAL_OVERLAP_RATIO
                && GeometryUtils.verticalSpanWithin(table, container, rule.getProximityPx());
    }

    private boolean mostlyInside(BoundingBox element, BoundingBox container, ContainmentRule rule) {
        if (GeometryUtils.overlapRatio(element, container) > rule.getOverlapThreshold()) {
            return true;
        }
        return config.TABLE_CENTER_FALLBACK && GeometryUtils.centerInside(element, container);
    }

    private boolean overlapAndClose(BoundingBox element, BoundingBox container, ContainmentRule rule) {
        return GeometryUtils.overlapRatio(element, container) > rule.getOverlapThreshold()
                && GeometryUtils.verticallyClose(element, container, rule.getProximityPx());
    }

    private boolean checkboxBelongsToOption(BoundingBox checkbox, BoundingBox option, ContainmentRule rule) {
        if (config.CHECKBOX_MATCH_STRATEGY == CheckboxMatchStrategy.ALIGNMENT) {
            boolean yAligned = Math.abs(checkbox.getCenterY() - option.getCenterY()) < config.CHECKBOX_ALIGN_Y_PX;
            boolean toTheLeft = checkbox.right() < option.left() + config.CHECKBOX_ALIGN_BUFFER_PX;
            return yAligned && toTheLeft;
        }
        return overlapAndClose(checkbox, option, rule);
    }

    /**
     * 类别对对应的规则名（调试用）
     */
    public String describeRule(DetectionClass element, DetectionClass container) {
        ContainmentRule rule = config.findRule(element, container);
        return rule == null ? "default" : rule.getName();
    }
}

package com.example.formstructure.util.containment;

import com.example.formstructure.util.structure.dto.DetectionClass;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 类别对包含规则（配置表中的一行）
 *
 * containerClass 为 null 表示匹配任意容器类别。
 */
public class ContainmentRule {

    private final String name;
    private final Set<DetectionClass> elementClasses;
    private final DetectionClass containerClass;
    private final RuleKind kind;
    private double overlapThreshold;
    private double proximityPx;

    public ContainmentRule(String name, Set<DetectionClass> elementClasses, DetectionClass containerClass,
                           RuleKind kind, double overlapThreshold, double proximityPx) {
        this.name = name;
        this.elementClasses = Collections.unmodifiableSet(EnumSet.copyOf(elementClasses));
        this.containerClass = containerClass;
        this.kind = kind;
        this.overlapThreshold = overlapThreshold;
        this.proximityPx = proximityPx;
    }

    /**
     * 类别对是否命中本规则
     */
    public boolean matches(DetectionClass element, DetectionClass container) {
        return elementClasses.contains(element) && (containerClass == null || containerClass == container);
    }

    public String getName() {
        return name;
    }

    public Set<DetectionClass> getElementClasses() {
        return elementClasses;
    }

    public DetectionClass getContainerClass() {
        return containerClass;
    }

    public RuleKind getKind() {
        return kind;
    }

    public double getOverlapThreshold() {
        return overlapThreshold;
    }

    public void setOverlapThreshold(double overlapThreshold) {
        this.overlapThreshold = overlapThreshold;
    }

    public double getProximityPx() {
        return proximityPx;
    }

    public void setProximityPx(double proximityPx) {
        this.proximityPx = proximityPx;
    }

    @Override
    public String toString() {
        return name + "{kind=" + kind + ", overlap=" + overlapThreshold + ", proximity=" + proximityPx + "}";
    }
}

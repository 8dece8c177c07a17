package com.example.formstructure.config;

import com.example.formstructure.util.containment.ContainmentClassifier;
import com.example.formstructure.util.containment.ContainmentConfig;
import com.example.formstructure.util.hierarchy.HierarchyBuilder;
import com.example.formstructure.util.table.TableLayoutConfig;
import com.example.formstructure.util.table.TableLayoutEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 核心组件装配
 *
 * util 下的核心类不读取 Spring 配置，全部通过构造参数拿到显式的配置对象。
 */
@Slf4j
@Configuration
public class FormStructureConfig {

    /**
     * 包含判定配置 JSON 路径（为空时使用基线规则表）
     */
    @Value("${form-structure.containment.config-path:}")
    private String containmentConfigPath;

    /**
     * 表格布局配置 JSON 路径（为空时使用默认值）
     */
    @Value("${form-structure.table.config-path:}")
    private String tableConfigPath;

    /**
     * section / table 节点不输出 OCR 文本
     */
    @Value("${form-structure.hierarchy.blank-container-text:true}")
    private boolean blankContainerText;

    @Bean
    public ContainmentConfig containmentConfig() {
        ContainmentConfig config = containmentConfigPath.isEmpty()
                ? ContainmentConfig.loadDefault()
                : ContainmentConfig.loadFromJson(containmentConfigPath);
        log.info("包含判定配置: {}", config);
        return config;
    }

    @Bean
    public ContainmentClassifier containmentClassifier(ContainmentConfig containmentConfig) {
        return new ContainmentClassifier(containmentConfig);
    }

    @Bean
    public HierarchyBuilder hierarchyBuilder(ContainmentClassifier containmentClassifier) {
        return new HierarchyBuilder(containmentClassifier, blankContainerText);
    }

    @Bean
    public TableLayoutConfig tableLayoutConfig() {
        TableLayoutConfig config = tableConfigPath.isEmpty()
                ? TableLayoutConfig.loadDefault()
                : TableLayoutConfig.loadFromJson(tableConfigPath);
        log.info("表格布局配置: {}", config);
        return config;
    }

    @Bean
    public TableLayoutEngine tableLayoutEngine(TableLayoutConfig tableLayoutConfig) {
        return new TableLayoutEngine(tableLayoutConfig);
    }
}

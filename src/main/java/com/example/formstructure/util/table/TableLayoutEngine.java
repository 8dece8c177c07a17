package com.example.formstructure.util.table;

import com.example.formstructure.util.common.TextUtils;
import com.example.formstructure.util.geometry.BoundingBox;
import com.example.formstructure.util.structure.dto.DetectionClass;
import com.example.formstructure.util.structure.dto.ExtractedTable;
import com.example.formstructure.util.structure.dto.TableField;
import com.example.formstructure.util.structure.dto.TableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表格布局推断引擎
 *
 * 功能：
 * - 根据字段坐标判断表格布局类型（单表头 / 双轴 / 编号行）
 * - 为 OCR 文本为空的字段合成上下文标签
 *
 * 算法：
 * 1. 按 y 坐标聚类成行（容差 ROW_TOLERANCE_PX），title 字段不参与
 * 2. 第一个有文本的行作为表头行，表头行中有文本的字段作为列头
 * 3. 每行最左侧、x 小于 LEFT_MARGIN_PX 的有文本字段作为行头
 * 4. 空字段：取水平距离最近的列头，按布局类型拼接上下文
 *
 * 推断是启发式的，只依据位置，不判断语义正确性；无法判断时输出 UNKNOWN_FIELD_LABEL。
 * 表头行及其上方的行不合成上下文。
 */
public class TableLayoutEngine {

    private static final Logger log = LoggerFactory.getLogger(TableLayoutEngine.class);

    private final TableLayoutConfig config;

    public TableLayoutEngine(TableLayoutConfig config) {
        this.config = config;
    }

    /**
     * 单元格（带坐标的字段）
     */
    static class Cell {
        final TableField field;
        final double x;
        final double y;
        final String text;

        Cell(TableField field, BoundingBox box) {
            this.field = field;
            this.x = box.getCenterX();
            this.y = box.getCenterY();
            this.text = TextUtils.trimToEmpty(field.getText());
        }

        boolean isEmpty() {
            return text.isEmpty();
        }
    }

    /**
     * 行（y 坐标聚类结果）
     */
    static class Row {
        final double anchorY;  // 行中第一个单元格的 y
        final List<Cell> cells = new ArrayList<>();

        Row(double anchorY) {
            this.anchorY = anchorY;
        }

        boolean hasText() {
            for (Cell cell : cells) {
                if (!cell.isEmpty()) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * 列头
     */
    static class ColumnHeader {
        final double x;
        final String text;

        ColumnHeader(double x, String text) {
            this.x = x;
            this.text = text;
        }
    }

    /**
     * 表格布局分析结果
     */
    static class Layout {
        List<Row> rows = new ArrayList<>();
        int headerIndex = -1;
        List<ColumnHeader> columnHeaders = new ArrayList<>();
        Map<Row, String> rowLabels = new LinkedHashMap<>();  // 仅数据行

        boolean hasHeader() {
            return headerIndex >= 0 && !columnHeaders.isEmpty();
        }

        List<Row> dataRows() {
            if (headerIndex < 0) {
                return new ArrayList<>();
            }
            return rows.subList(headerIndex + 1, rows.size());
        }
    }

    /**
     * 处理所有表格
     *
     * 返回新的表格副本：table_type 赋值，空字段的 text 替换为合成的上下文。输入不被修改。
     *
     * @param tables tableId -> 提取出的表格
     * @return tableId -> 处理后的表格（顺序不变）
     */
    public Map<String, ExtractedTable> processTables(Map<String, ExtractedTable> tables) {
        Map<String, ExtractedTable> processed = new LinkedHashMap<>();
        int filled = 0;

        for (Map.Entry<String, ExtractedTable> entry : tables.entrySet()) {
            ExtractedTable table = entry.getValue().copy();
            TableType tableType = inferTableType(table.getFields());
            Map<String, String> contexts = synthesizeContext(table, tableType);

            for (TableField field : table.getFields()) {
                String context = contexts.get(field.getId());
                if (context != null) {
                    field.setText(context);
                    filled++;
                }
            }
            table.setTableType(tableType);
            processed.put(entry.getKey(), table);
            log.debug("表格 {} 类型={}, 合成上下文={}", entry.getKey(), tableType.getValue(), contexts.size());
        }

        log.info("表格解析完成: 表格={}, 填充空字段={}", processed.size(), filled);
        return processed;
    }

    /**
     * 推断表格布局类型
     *
     * - NUMBERED_ROWS：数据行的行头全部匹配行号格式
     * - TWO_AXIS：数据行的行头中至少有一个与表头行行头不同的文本
     * - SINGLE_HEADER：默认（包括找不到表头行的情况）
     *
     * @param fields 表格字段
     * @return 布局类型
     */
    public TableType inferTableType(List<TableField> fields) {
        Layout layout = analyze(fields);
        if (!layout.hasHeader()) {
            return TableType.SINGLE_HEADER;
        }

        Set<String> labels = new LinkedHashSet<>(layout.rowLabels.values());
        if (labels.isEmpty()) {
            return TableType.SINGLE_HEADER;
        }

        boolean allNumbered = true;
        for (String label : labels) {
            if (!config.getNumberedRowPattern().matcher(label).matches()) {
                allNumbered = false;
                break;
            }
        }
        if (allNumbered) {
            return TableType.NUMBERED_ROWS;
        }

        String headerLabel = rowLabel(layout.rows.get(layout.headerIndex));
        if (headerLabel != null) {
            labels.remove(headerLabel);
        }
        return labels.isEmpty() ? TableType.SINGLE_HEADER : TableType.TWO_AXIS;
    }

    /**
     * 为空字段合成上下文
     *
     * 格式：
     * - SINGLE_HEADER：有行头时 "行头 - 列头"，否则 "列头行序号"
     * - TWO_AXIS："行头 列头"（本行无行头时继承 y 距离最近的有行头的行）
     * - NUMBERED_ROWS："列头行号"
     *
     * 找不到表头行时返回空映射，空字段保持为空。
     *
     * @param table 表格
     * @param tableType 布局类型
     * @return detectionId -> 上下文
     */
    public Map<String, String> synthesizeContext(ExtractedTable table, TableType tableType) {
        Map<String, String> contexts = new LinkedHashMap<>();
        Layout layout = analyze(table.getFields());

        if (!layout.hasHeader()) {
            log.debug("表格 {} 没有表头行，跳过上下文合成", table.getDetectionId());
            return contexts;
        }

        List<Row> dataRows = layout.dataRows();
        for (int i = 0; i < dataRows.size(); i++) {
            Row row = dataRows.get(i);
            int rowIndex = i + 1;
            for (Cell cell : row.cells) {
                if (!cell.isEmpty()) {
                    continue;
                }
                String column = nearestColumn(layout.columnHeaders, cell.x);
                contexts.put(cell.field.getId(), formatContext(layout, row, rowIndex, column, tableType));
            }
        }

        // 没有坐标的空字段无法定位
        for (TableField field : table.getFields()) {
            if (field.getType() != DetectionClass.TITLE && TextUtils.isBlank(field.getText())
                    && field.getBoundingBox() == null) {
                contexts.put(field.getId(), config.UNKNOWN_FIELD_LABEL);
            }
        }
        return contexts;
    }

    private String formatContext(Layout layout, Row row, int rowIndex, String column, TableType tableType) {
        if (column == null) {
            return config.UNKNOWN_FIELD_LABEL;
        }
        String label = layout.rowLabels.get(row);

        switch (tableType) {
            case TWO_AXIS:
                String rowHeader = label != null ? label : inheritRowLabel(layout, row);
                if (rowHeader == null) {
                    return config.UNKNOWN_FIELD_LABEL;
                }
                return rowHeader + " " + column;
            case NUMBERED_ROWS:
                String number = label != null && config.getNumberedRowPattern().matcher(label).matches()
                        ? stripTrailingPeriod(label)
                        : String.valueOf(rowIndex);
                return column + number;
            case SINGLE_HEADER:
            default:
                if (label != null) {
                    return label + " - " + column;
                }
                return column + rowIndex;
        }
    }

    /**
     * 按 y 距离继承最近的有行头的数据行的行头（距离相同取上方的行）
     */
    private String inheritRowLabel(Layout layout, Row row) {
        String inherited = null;
        double minDistance = Double.MAX_VALUE;
        for (Map.Entry<Row, String> entry : layout.rowLabels.entrySet()) {
            double distance = Math.abs(entry.getKey().anchorY - row.anchorY);
            if (distance < minDistance) {
                minDistance = distance;
                inherited = entry.getValue();
            }
        }
        return inherited;
    }

    /**
     * 水平距离最近的列头（距离相同取左侧的列）
     */
    private static String nearestColumn(List<ColumnHeader> headers, double x) {
        String nearest = null;
        double minDistance = Double.MAX_VALUE;
        for (ColumnHeader header : headers) {
            double distance = Math.abs(header.x - x);
            if (distance < minDistance) {
                minDistance = distance;
                nearest = header.text;
            }
        }
        return nearest;
    }

    private static String stripTrailingPeriod(String label) {
        return label.endsWith(".") ? label.substring(0, label.length() - 1) : label;
    }

    /**
     * 行头：最左侧、x 小于 LEFT_MARGIN_PX 的有文本单元格
     */
    private String rowLabel(Row row) {
        for (Cell cell : row.cells) {
            if (cell.x >= config.LEFT_MARGIN_PX) {
                break;
            }
            if (!cell.isEmpty()) {
                return cell.text;
            }
        }
        return null;
    }

    /**
     * 布局分析：行聚类、表头行、列头、行头
     */
    Layout analyze(List<TableField> fields) {
        Layout layout = new Layout();
        layout.rows = groupRows(fields);

        for (int i = 0; i < layout.rows.size(); i++) {
            if (layout.rows.get(i).hasText()) {
                layout.headerIndex = i;
                break;
            }
        }
        if (layout.headerIndex < 0) {
            return layout;
        }

        for (Cell cell : layout.rows.get(layout.headerIndex).cells) {
            if (!cell.isEmpty()) {
                layout.columnHeaders.add(new ColumnHeader(cell.x, cell.text));
            }
        }
        for (Row row : layout.dataRows()) {
            String label = rowLabel(row);
            if (label != null) {
                layout.rowLabels.put(row, label);
            }
        }
        return layout;
    }

    /**
     * 按 y 坐标聚类成行
     *
     * 单元格先按 (y, x) 排序，再依次归入第一个 |y - anchorY| 小于容差的行。
     */
    List<Row> groupRows(List<TableField> fields) {
        List<Cell> cells = new ArrayList<>();
        for (TableField field : fields) {
            if (field.getType() == DetectionClass.TITLE) {
                continue;
            }
            BoundingBox box = field.getBoundingBox();
            if (box == null) {
                continue;
            }
            cells.add(new Cell(field, box));
        }
        cells.sort(Comparator.comparingDouble((Cell c) -> c.y).thenComparingDouble(c -> c.x));

        List<Row> rows = new ArrayList<>();
        for (Cell cell : cells) {
            Row target = null;
            for (Row row : rows) {
                if (Math.abs(cell.y - row.anchorY) < config.ROW_TOLERANCE_PX) {
                    target = row;
                    break;
                }
            }
            if (target == null) {
                target = new Row(cell.y);
                rows.add(target);
            }
            target.cells.add(cell);
        }

        rows.sort(Comparator.comparingDouble((Row r) -> r.anchorY));
        for (Row row : rows) {
            row.cells.sort(Comparator.comparingDouble((Cell c) -> c.x));
        }
        return rows;
    }
}

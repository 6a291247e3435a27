package com.pipeline.battery.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表格数据帧：有序列名 + 按行存储的字符串值。
 * 空白单元格以null保存，数值转换由各处理环节自行完成。
 */
public class RowFrame implements Serializable {
    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public RowFrame(List<String> columns) {
        this.columns = new ArrayList<>(columns);
        this.rows = new ArrayList<>();
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int columnCount() {
        return columns.size();
    }

    public void addRow(Map<String, String> values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, values.get(column));
        }
        rows.add(row);
    }

    public List<Map<String, String>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public Map<String, String> getRow(int index) {
        return Collections.unmodifiableMap(rows.get(index));
    }

    public String getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(column);
    }

    /** 按行顺序返回某列的全部值；列不存在时返回空列表 */
    public List<String> getColumnValues(String column) {
        if (!hasColumn(column)) return Collections.emptyList();
        List<String> values = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * 将source列复制为target列。
     * target已存在或source不存在时不做任何修改。
     *
     * @return 是否实际复制
     */
    public boolean copyColumn(String source, String target) {
        if (hasColumn(target) || !hasColumn(source)) {
            return false;
        }
        columns.add(target);
        for (Map<String, String> row : rows) {
            row.put(target, row.get(source));
        }
        return true;
    }

    /** 以相同列结构包装给定的行集合（行对象会被复制） */
    public RowFrame withRows(List<Map<String, String>> selectedRows) {
        RowFrame frame = new RowFrame(columns);
        for (Map<String, String> row : selectedRows) {
            frame.addRow(row);
        }
        return frame;
    }

    public RowFrame copy() {
        return withRows(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}

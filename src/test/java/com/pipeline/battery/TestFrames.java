package com.pipeline.battery;

import com.pipeline.battery.model.RowFrame;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 测试用数据帧与夹具工具
 */
public final class TestFrames {

    private TestFrames() {}

    /**
     * @param columns 列名
     * @param rows    与列一一对应的取值，空字符串或null表示空白
     */
    public static RowFrame frame(List<String> columns, String[]... rows) {
        RowFrame frame = new RowFrame(columns);
        for (String[] values : rows) {
            Map<String, String> row = new HashMap<>();
            for (int i = 0; i < columns.size() && i < values.length; i++) {
                String value = values[i];
                row.put(columns.get(i), value == null || value.isEmpty() ? null : value);
            }
            frame.addRow(row);
        }
        return frame;
    }

    public static String[] row(String... values) {
        return Arrays.copyOf(values, values.length);
    }

    public static byte[] fixture(String name) {
        try (InputStream in = TestFrames.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

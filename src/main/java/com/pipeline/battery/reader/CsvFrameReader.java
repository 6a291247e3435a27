package com.pipeline.battery.reader;

import com.pipeline.battery.core.StructuralException;
import com.pipeline.battery.model.RowFrame;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 将上传的CSV字节解析为{@link RowFrame}。
 *
 * 第一条非空记录作为表头；容忍UTF-8 BOM；
 * 空白表头列被忽略，重名表头只保留第一次出现的列。
 */
public class CsvFrameReader {

    private static final Logger log = LoggerFactory.getLogger(CsvFrameReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final Charset charset;

    public CsvFrameReader(Charset charset) {
        this.charset = charset;
    }

    /**
     * @param content  原始文件内容
     * @param filename 仅用于日志与错误消息
     * @throws StructuralException 内容不是可解析的带表头CSV
     */
    public RowFrame read(byte[] content, String filename) {
        String text = new String(content, charset);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }

        try (CSVParser parser = FORMAT.parse(new StringReader(text))) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new StructuralException("File '" + filename + "' is empty: no header row");
            }

            // 表头位置 -> 列名
            Map<Integer, String> headerAt = new LinkedHashMap<>();
            Map<String, Integer> seen = new HashMap<>();
            CSVRecord header = records.next();
            for (int i = 0; i < header.size(); i++) {
                String name = header.get(i);
                if (name == null || name.isBlank()) continue;
                if (seen.putIfAbsent(name, i) != null) {
                    log.warn("Duplicate header '{}' in '{}', keeping first occurrence", name, filename);
                    continue;
                }
                headerAt.put(i, name);
            }
            if (headerAt.isEmpty()) {
                throw new StructuralException("File '" + filename + "' has no usable header columns");
            }

            RowFrame frame = new RowFrame(new ArrayList<>(headerAt.values()));
            while (records.hasNext()) {
                CSVRecord record = records.next();
                Map<String, String> row = new HashMap<>();
                for (Map.Entry<Integer, String> column : headerAt.entrySet()) {
                    int index = column.getKey();
                    String value = index < record.size() ? record.get(index) : null;
                    row.put(column.getValue(), CellValues.isBlank(value) ? null : value);
                }
                frame.addRow(row);
            }

            log.info("Parsed '{}': {} rows, {} columns", filename, frame.size(), frame.columnCount());
            return frame;

        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new StructuralException("Unreadable CSV '" + filename + "': " + e.getMessage(), e);
        }
    }
}

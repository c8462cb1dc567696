package io.github.samzhu.monitor.export;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * CSV 輸出，第一列為欄位名稱，缺值輸出為空欄位。
 *
 * @see <a href="https://github.com/FasterXML/jackson-dataformats-text/tree/2.18/csv">Jackson CSV</a>
 */
@Component
public class CsvTableFormatter implements TableFormatter {

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public String render(NormalizedTable table) {
        if (table.columns().isEmpty()) {
            return "";
        }
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : table.columns()) {
            schema.addColumn(column);
        }

        StringWriter out = new StringWriter();
        try (SequenceWriter writer = csvMapper.writer(schema.setUseHeader(true).build()).writeValues(out)) {
            writer.writeAll(table.toRecords());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV for column set " + table.columns(), e);
        }
        return out.toString();
    }
}

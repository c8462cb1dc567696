package io.github.samzhu.monitor.export;

import java.io.UncheckedIOException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * Record 形式的 JSON 陣列：每列一個物件，鍵順序即欄位順序，日期為 ISO-8601 字串。
 */
@Component
public class JsonTableFormatter implements TableFormatter {

    private final ObjectMapper objectMapper;

    public JsonTableFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String render(NormalizedTable table) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(table.toRecords());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON for column set " + table.columns(), e);
        }
    }
}

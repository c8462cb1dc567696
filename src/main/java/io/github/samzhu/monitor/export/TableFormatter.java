package io.github.samzhu.monitor.export;

import io.github.samzhu.monitor.table.NormalizedTable;

/**
 * 將正規化表格序列化為文字，保留欄位與列的順序。
 */
public interface TableFormatter {

    OutputFormat format();

    String render(NormalizedTable table);
}

package io.github.samzhu.monitor.catalog;

import java.util.Locale;
import java.util.Optional;

/**
 * 後端資料點要讀取的值型別。
 *
 * <ul>
 *   <li>{@link #INT64} - 直接取整數值</li>
 *   <li>{@link #DISTRIBUTION} - 只取 distribution 的 {@code count}，不取平均、總和或百分位</li>
 * </ul>
 */
public enum ValueField {

    INT64("int64"),
    DISTRIBUTION("distribution");

    private final String token;

    ValueField(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * 解析設定檔中的 token。
     *
     * <p>同時接受 {@code int64} 與後端欄位名稱 {@code int64_value} 兩種寫法。
     *
     * @param token 設定值
     * @return 對應的值型別，無法辨識時為空
     */
    public static Optional<ValueField> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("_value")) {
            normalized = normalized.substring(0, normalized.length() - "_value".length());
        }
        for (ValueField field : values()) {
            if (field.token.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}

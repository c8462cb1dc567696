package io.github.samzhu.monitor.catalog;

import java.util.List;

/**
 * 每個查詢都會分組的五個固定資源維度。
 *
 * <p>後端只會回傳 group-by 清單中明列的 label，因此這五個維度一律請求，
 * 讓所有指標都能以模型身分互相對照。
 */
public final class ResourceLabels {

    public static final String PROJECT_ID = "project_id";
    public static final String LOCATION = "location";
    public static final String PUBLISHER = "publisher";
    public static final String MODEL_USER_ID = "model_user_id";
    public static final String MODEL_VERSION_ID = "model_version_id";

    /** 依查詢 group-by 的順序排列。 */
    public static final List<String> ALL = List.of(
        PROJECT_ID, LOCATION, PUBLISHER, MODEL_USER_ID, MODEL_VERSION_ID);

    private ResourceLabels() {
    }
}

package io.github.samzhu.monitor.chart;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 將圖表序列繪製並存檔。
 */
public interface ChartRenderer {

    /**
     * @param projection 圖表序列
     * @return 輸出檔路徑；沒有資料或寫檔失敗時為空
     */
    Optional<Path> render(ChartProjection projection);
}

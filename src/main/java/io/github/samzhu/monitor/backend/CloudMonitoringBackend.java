package io.github.samzhu.monitor.backend;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.google.api.gax.rpc.PermissionDeniedException;
import com.google.api.gax.rpc.UnauthenticatedException;
import com.google.cloud.monitoring.v3.MetricServiceClient;
import com.google.monitoring.v3.Aggregation;
import com.google.monitoring.v3.ListTimeSeriesRequest;
import com.google.monitoring.v3.Point;
import com.google.monitoring.v3.TimeInterval;
import com.google.monitoring.v3.TimeSeries;
import com.google.monitoring.v3.TypedValue;
import com.google.protobuf.Duration;
import com.google.protobuf.Timestamp;

import io.github.samzhu.monitor.dto.PointValue;
import io.github.samzhu.monitor.dto.RawPoint;
import io.github.samzhu.monitor.dto.RawSeries;
import io.github.samzhu.monitor.dto.TimeSeriesQuery;
import io.github.samzhu.monitor.exception.BackendAuthorizationException;
import io.github.samzhu.monitor.exception.BackendCallException;

/**
 * Cloud Monitoring v3 {@code projects.timeSeries.list} 轉接層。
 *
 * <p>每次查詢建立一個 {@link MetricServiceClient}，查詢完成即關閉；認證使用
 * Application Default Credentials。錯誤轉換：
 * <ul>
 *   <li>{@code PERMISSION_DENIED}、{@code UNAUTHENTICATED} → {@link BackendAuthorizationException}</li>
 *   <li>其他 API 錯誤、建立 client 失敗或任何執行期例外 → {@link BackendCallException}</li>
 * </ul>
 *
 * @see <a href="https://cloud.google.com/monitoring/api/ref_v3/rest/v3/projects.timeSeries/list">timeSeries.list</a>
 */
@Component
public class CloudMonitoringBackend implements TimeSeriesBackend {

    private static final Logger log = LoggerFactory.getLogger(CloudMonitoringBackend.class);

    /**
     * 建立 Cloud Monitoring client。
     */
    @FunctionalInterface
    public interface ClientFactory {
        MetricServiceClient create() throws IOException;
    }

    private final ClientFactory clientFactory;

    public CloudMonitoringBackend() {
        this(MetricServiceClient::create);
    }

    CloudMonitoringBackend(ClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public List<RawSeries> listTimeSeries(TimeSeriesQuery query) {
        ListTimeSeriesRequest request = toRequest(query);
        log.debug("ListTimeSeries: name={}, filter={}, groupBy={}",
            request.getName(), request.getFilter(), request.getAggregation().getGroupByFieldsList());

        try (MetricServiceClient client = clientFactory.create()) {
            List<RawSeries> series = new ArrayList<>();
            for (TimeSeries timeSeries : client.listTimeSeries(request).iterateAll()) {
                series.add(toRawSeries(timeSeries));
            }
            log.debug("ListTimeSeries returned {} series for {}", series.size(), query.filter());
            return series;
        } catch (PermissionDeniedException | UnauthenticatedException e) {
            throw new BackendAuthorizationException(query.scopeName(), query.filter(), e);
        } catch (RuntimeException | IOException e) {
            throw new BackendCallException(query.scopeName(), query.filter(), e);
        }
    }

    /**
     * 將查詢描述轉為 Cloud Monitoring 請求（view = FULL）。
     */
    static ListTimeSeriesRequest toRequest(TimeSeriesQuery query) {
        TimeInterval interval = TimeInterval.newBuilder()
            .setStartTime(toTimestamp(query.window().start()))
            .setEndTime(toTimestamp(query.window().end()))
            .build();

        Aggregation aggregation = Aggregation.newBuilder()
            .setAlignmentPeriod(Duration.newBuilder().setSeconds(query.alignmentPeriod().getSeconds()).build())
            .setPerSeriesAligner(Aggregation.Aligner.valueOf(query.aligner().name()))
            .setCrossSeriesReducer(Aggregation.Reducer.valueOf(query.reducer().name()))
            .addAllGroupByFields(query.groupByFields())
            .build();

        return ListTimeSeriesRequest.newBuilder()
            .setName(query.scopeName())
            .setFilter(query.filter())
            .setInterval(interval)
            .setAggregation(aggregation)
            .setView(ListTimeSeriesRequest.TimeSeriesView.FULL)
            .build();
    }

    /**
     * 將 Cloud Monitoring 的 TimeSeries 轉為後端無關的 {@link RawSeries}。
     */
    static RawSeries toRawSeries(TimeSeries timeSeries) {
        List<RawPoint> points = new ArrayList<>(timeSeries.getPointsCount());
        for (Point point : timeSeries.getPointsList()) {
            Timestamp end = point.getInterval().getEndTime();
            points.add(new RawPoint(
                Instant.ofEpochSecond(end.getSeconds(), end.getNanos()),
                toPointValue(point.getValue())));
        }
        return new RawSeries(
            timeSeries.getResource().getLabelsMap(),
            timeSeries.getMetric().getLabelsMap(),
            points);
    }

    private static PointValue toPointValue(TypedValue value) {
        return switch (value.getValueCase()) {
            case INT64_VALUE -> PointValue.ofInt64(value.getInt64Value());
            case DISTRIBUTION_VALUE -> PointValue.ofDistribution(
                value.getDistributionValue().getCount(), value.getDistributionValue().getMean());
            default -> PointValue.unsupported();
        };
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
            .setSeconds(instant.getEpochSecond())
            .setNanos(instant.getNano())
            .build();
    }
}

package com.bulkops.service.batching;

import com.bulkops.config.JacksonConfig;
import com.bulkops.exception.LimitConfigurationException;
import com.bulkops.model.Batch;
import com.bulkops.model.BatchLimits;
import com.bulkops.model.OperationKind;
import com.bulkops.model.OperationPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for LimitAwareBatcher.
 *
 * Tests verify:
 * - Batches respect both row and byte limits
 * - Records stay in plan order and none are lost
 * - Oversized records and bad limits are reported
 */
class LimitAwareBatcherTest {

    private RecordSizeEstimator estimator;
    private LimitAwareBatcher batcher;

    @BeforeEach
    void setUp() {
        estimator = new RecordSizeEstimator(JacksonConfig.createObjectMapper(), 2);
        batcher = new LimitAwareBatcher(estimator, 10_000, 10_485_760);
    }

    @Test
    @DisplayName("Should split 10,050 records into batches of 10000 and 50")
    void shouldSplitByRowLimit() {
        // Given
        OperationPlan plan = plan(records(10_050), 10_000);

        // When
        List<Batch> batches = collect(batcher.split(plan, new BatchLimits(10_000, 100_000_000L)));

        // Then
        assertThat(batches).extracting(Batch::rowCount).containsExactly(10_000, 50);
        assertThat(batches).extracting(Batch::firstIndex).containsExactly(0, 10_000);
        assertThat(batches).extracting(Batch::sequence).containsExactly(0, 1);
    }

    @Test
    @DisplayName("Should keep every batch within both limits and preserve plan order")
    void shouldRespectBothLimits() {
        // Given
        List<Map<String, Object>> records = records(500);
        long perRecord = estimator.estimate(records.get(0));
        BatchLimits limits = new BatchLimits(120, perRecord * 37 + 5);

        // When
        List<Batch> batches = collect(batcher.split(plan(records, 10_000), limits));

        // Then
        assertThat(batches).allSatisfy(b -> {
            assertThat(b.rowCount()).isLessThanOrEqualTo(limits.maxRowsPerBatch());
            assertThat(b.estimatedBytes()).isLessThanOrEqualTo(limits.maxBytesPerBatch());
        });
        List<Object> seen = batches.stream().flatMap(b -> b.records().stream()).map(r -> r.get("Name")).toList();
        assertThat(seen).isEqualTo(records.stream().map(r -> r.get("Name")).toList());
    }

    @Test
    @DisplayName("Should use the chunk size hint when it is below the row limit")
    void shouldHonorChunkSizeHint() {
        List<Batch> batches = collect(batcher.split(plan(records(25), 10), batcher.defaultLimits()));

        assertThat(batches).extracting(Batch::rowCount).containsExactly(10, 10, 5);
    }

    @Test
    @DisplayName("Should yield no batches for an empty plan")
    void shouldHandleEmptyPlan() {
        assertThat(batcher.split(plan(List.of(), 10), batcher.defaultLimits())).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive limits before producing anything")
    void shouldRejectInvalidLimits() {
        assertThatThrownBy(() -> batcher.split(plan(records(5), 10), new BatchLimits(0, 100)))
                .isInstanceOf(LimitConfigurationException.class)
                .satisfies(e -> assertThat(((LimitConfigurationException) e).getRecordIndex()).isEqualTo(-1));
        assertThatThrownBy(() -> batcher.split(plan(records(5), 10), new BatchLimits(10, 0)))
                .isInstanceOf(LimitConfigurationException.class);
    }

    @Test
    @DisplayName("Should close the current batch before an oversized record, then report that record")
    void shouldReportOversizedRecord() {
        // Given
        List<Map<String, Object>> records = new ArrayList<>(records(3));
        records.add(1, Map.of("Name", "x".repeat(5_000)));
        BatchLimits limits = new BatchLimits(100, 1_000);
        Iterator<Batch> batches = batcher.split(plan(records, 100), limits).iterator();

        // When
        Batch first = batches.next();

        // Then
        assertThat(first.rowCount()).isEqualTo(1);
        assertThatThrownBy(batches::next)
                .isInstanceOf(LimitConfigurationException.class)
                .satisfies(e -> assertThat(((LimitConfigurationException) e).getRecordIndex()).isEqualTo(1));

        // resuming after the oversized record keeps the remaining rows
        List<Batch> rest = collect(batcher.split(plan(records, 100), limits, 2, 2));
        assertThat(rest).singleElement().satisfies(b -> {
            assertThat(b.firstIndex()).isEqualTo(2);
            assertThat(b.sequence()).isEqualTo(2);
            assertThat(b.rowCount()).isEqualTo(2);
        });
    }

    private static List<Map<String, Object>> records(int count) {
        return IntStream.range(0, count)
                .<Map<String, Object>>mapToObj(i -> Map.of("Name", String.format("Widget %05d", i)))
                .toList();
    }

    private static OperationPlan plan(List<Map<String, Object>> records, int chunkSize) {
        return new OperationPlan(OperationKind.INSERT, "Widget", records, null, null, chunkSize, records.size(),
                null, false, false, false);
    }

    private static List<Batch> collect(Iterable<Batch> batches) {
        List<Batch> result = new ArrayList<>();
        batches.forEach(result::add);
        return result;
    }
}

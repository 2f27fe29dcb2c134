package com.bulkops.service;

import com.bulkops.model.FailedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reports failed rows so the caller can retry exactly those rows.
 */
@Service
@Slf4j
public class FailedRowPublisher {

    public void publish(String objectName, List<FailedRow> failedRows) {
        if (failedRows.isEmpty()) {
            return;
        }

        Map<String, Long> byCode = failedRows.stream()
                .collect(Collectors.groupingBy(f -> String.valueOf(f.errorCode()), TreeMap::new, Collectors.counting()));
        log.warn("{} failed row(s) on {}: {}", failedRows.size(), objectName, byCode);

        for (FailedRow failed : failedRows) {
            log.warn("  FAILED: {} row {} - {} ({})", objectName, failed.index(), failed.message(), failed.errorCode());
        }
    }
}

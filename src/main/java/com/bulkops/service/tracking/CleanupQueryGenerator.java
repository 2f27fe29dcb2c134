package com.bulkops.service.tracking;

import com.bulkops.model.CleanupPattern;
import com.bulkops.model.CleanupPredicate;
import com.bulkops.model.CommitAction;
import com.bulkops.model.RecordTrace;
import com.bulkops.model.RollbackMarker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds deletion predicates for out-of-band cleanup, when in-process rollback is no longer possible.
 *
 * Tracked-id predicates are chunked so no single query exceeds the configured id count.
 * Pattern and window predicates select records regardless of tracking; the two mechanisms
 * are independent and the caller picks one.
 */
@Component
@Slf4j
public class CleanupQueryGenerator {

    static final String DEFAULT_NAME_FIELD = "Name";
    static final String CREATED_DATE_FIELD = "CreatedDate";

    private final RecordTracker tracker;
    private final int maxIdsPerQuery;

    public CleanupQueryGenerator(
            RecordTracker tracker,
            @Value("${app.cleanup.max-ids-per-query:200}") int maxIdsPerQuery) {
        if (maxIdsPerQuery <= 0) {
            throw new IllegalArgumentException("maxIdsPerQuery must be positive: " + maxIdsPerQuery);
        }
        this.tracker = tracker;
        this.maxIdsPerQuery = maxIdsPerQuery;
    }

    public List<CleanupPredicate> generate(CleanupPattern pattern) {
        return generate(pattern, RollbackMarker.ORIGIN);
    }

    /**
     * @param pattern selector
     * @param since   for tracked ids, only traces after this marker are considered
     * @return predicates, empty when nothing matches
     */
    public List<CleanupPredicate> generate(CleanupPattern pattern, RollbackMarker since) {
        List<CleanupPredicate> predicates = switch (pattern.strategy()) {
            case BY_TRACKED_IDS -> byTrackedIds(pattern.objectName(), since);
            case BY_NAME_PATTERN -> List.of(byNamePattern(pattern));
            case BY_CREATED_WINDOW -> List.of(byCreatedWindow(pattern));
        };
        log.info("Generated {} cleanup predicate(s) for {} by {}",
                predicates.size(), pattern.objectName(), pattern.strategy());
        return predicates;
    }

    private List<CleanupPredicate> byTrackedIds(String objectName, RollbackMarker since) {
        Set<String> ids = new LinkedHashSet<>();
        for (RecordTrace trace : tracker.tracesSince(since)) {
            // only rows this session created are safe to delete
            if (trace.objectName().equals(objectName) && trace.action() == CommitAction.CREATED
                    && !tracker.isCompensated(trace)) {
                ids.add(trace.recordId());
            }
        }
        List<CleanupPredicate> predicates = new ArrayList<>();
        for (List<String> chunk : partition(new ArrayList<>(ids), maxIdsPerQuery)) {
            StringBuilder predicate = new StringBuilder("Id IN (");
            for (int i = 0; i < chunk.size(); i++) {
                if (i > 0) {
                    predicate.append(", ");
                }
                predicate.append(quote(chunk.get(i)));
            }
            predicate.append(')');
            predicates.add(predicate(objectName, predicate.toString(), chunk.size()));
        }
        return predicates;
    }

    private CleanupPredicate byNamePattern(CleanupPattern pattern) {
        if (pattern.namePattern() == null || pattern.namePattern().isBlank()) {
            throw new IllegalArgumentException("Name pattern is required for " + pattern.strategy());
        }
        String field = pattern.fieldName() == null ? DEFAULT_NAME_FIELD : pattern.fieldName();
        return predicate(pattern.objectName(), field + " LIKE " + quote(pattern.namePattern()), 0);
    }

    private CleanupPredicate byCreatedWindow(CleanupPattern pattern) {
        Instant from = pattern.createdFrom();
        Instant to = pattern.createdTo();
        if (from == null && to == null) {
            throw new IllegalArgumentException("A created window needs at least one bound");
        }
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Created window ends before it starts: " + from + " > " + to);
        }
        List<String> clauses = new ArrayList<>();
        if (from != null) {
            clauses.add(CREATED_DATE_FIELD + " >= " + from.truncatedTo(ChronoUnit.SECONDS));
        }
        if (to != null) {
            clauses.add(CREATED_DATE_FIELD + " <= " + to.truncatedTo(ChronoUnit.SECONDS));
        }
        return predicate(pattern.objectName(), String.join(" AND ", clauses), 0);
    }

    private static CleanupPredicate predicate(String objectName, String predicate, int idCount) {
        return new CleanupPredicate(objectName, predicate,
                "SELECT Id FROM " + objectName + " WHERE " + predicate, idCount);
    }

    static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static <T> List<List<T>> partition(List<T> list, int size) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += size) {
            partitions.add(list.subList(i, Math.min(i + size, list.size())));
        }
        return partitions;
    }
}

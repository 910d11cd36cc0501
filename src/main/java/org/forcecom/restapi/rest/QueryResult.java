package org.forcecom.restapi.rest;

import lombok.Getter;
import org.forcecom.restapi.model.QueryRecord;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Fully materialized result of a paginated query: the records of every page, in the order
 * the service delivered them.
 */
public class QueryResult implements Iterable<QueryRecord> {

    @Getter
    private final List<QueryRecord> records;

    /** Row count reported on the first page, or null if the service did not send one. */
    @Getter
    private final Integer totalSize;

    /** Number of pages (HTTP requests) it took to build this result. */
    @Getter
    private final int pageCount;

    public QueryResult(List<QueryRecord> records, Integer totalSize, int pageCount) {
        this.records = Collections.unmodifiableList(records);
        this.totalSize = totalSize;
        this.pageCount = pageCount;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public QueryRecord get(int index) {
        return records.get(index);
    }

    /**
     * Union of field names over all records, in first-seen order.
     *
     * @return Column names
     */
    public Set<String> getColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (QueryRecord record : records) {
            columns.addAll(record.getFieldNames());
        }
        return columns;
    }

    public Stream<QueryRecord> stream() {
        return records.stream();
    }

    @Override
    public Iterator<QueryRecord> iterator() {
        return records.iterator();
    }

    @Override
    public String toString() {
        return "QueryResult{size=" + records.size() + ", totalSize=" + totalSize + ", pageCount=" + pageCount + "}";
    }
}

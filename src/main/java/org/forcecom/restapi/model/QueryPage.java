package org.forcecom.restapi.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Decoded envelope of one query response.
 * <p>
 * A page carrying an {@link #getError() error} has no usable records.
 * </p>
 */
@Value
@Builder
public class QueryPage {

    @Builder.Default
    List<QueryRecord> records = List.of();

    /** Continuation reference of the next page; null on the last page. */
    String nextRecordsUrl;

    /** Total row count reported by the service, if any. */
    Integer totalSize;

    boolean done;

    ServiceError error;

    public boolean hasError() {
        return error != null;
    }

    public boolean hasNextRecords() {
        return StringUtils.isNotEmpty(nextRecordsUrl);
    }
}

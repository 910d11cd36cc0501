package org.forcecom.restapi.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One row of a SOQL result: field name to untyped text value, in the order the
 * fields appeared in the response.
 * <p>
 * Relationship fields are flattened with dotted names ({@code Owner.Name}).
 * A {@code null} value means the service sent the field as {@code xsi:nil}.
 * </p>
 */
@EqualsAndHashCode
@ToString
public final class QueryRecord {

    private final Map<String, String> fields;

    public QueryRecord(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the value of a field.
     *
     * @param fieldName Field name as returned by the service (dotted for relationships)
     * @return Field value, or null if the field is absent or nil
     */
    public String get(String fieldName) {
        return fields.get(fieldName);
    }

    public boolean has(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public Set<String> getFieldNames() {
        return fields.keySet();
    }

    public Map<String, String> asMap() {
        return fields;
    }
}

package com.warden.authz.field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write payload with the fields the caller may not write removed.
 */
public record WriteFilterResult(Map<String, Object> data, List<String> removedFields) {

    public WriteFilterResult {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        removedFields = List.copyOf(removedFields);
    }
}

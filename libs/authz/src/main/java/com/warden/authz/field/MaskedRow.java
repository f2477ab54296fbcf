package com.warden.authz.field;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A row after field masking.
 *
 * @param data          the visible row; values may be null
 * @param maskedFields  fields whose value was replaced
 * @param omittedFields fields removed from the row
 */
public record MaskedRow(Map<String, Object> data, List<String> maskedFields, List<String> omittedFields) {

    public MaskedRow {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        maskedFields = List.copyOf(maskedFields);
        omittedFields = List.copyOf(omittedFields);
    }

    static MaskedRow unchanged(Map<String, Object> row) {
        return new MaskedRow(row, List.of(), List.of());
    }

    public int hiddenCount() {
        return maskedFields.size() + omittedFields.size();
    }
}

package com.naag.docsync.store;

import com.naag.docsync.json.Json;
import com.naag.docsync.store.payload.RecordPayload;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload keys the stores rely on, and the conversion from typed payloads to stored maps.
 */
public final class PayloadFields {

    public static final String RECORD_ID = "record_id";
    public static final String LAST_MODIFIED = "last_modified";
    public static final String SOURCE_FILE_ID = "source_file_id";

    private PayloadFields() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> toMap(String recordId, RecordPayload payload) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(RECORD_ID, recordId);
        map.putAll(Json.PAYLOAD_MAPPER.convertValue(payload, Map.class));
        return map;
    }
}

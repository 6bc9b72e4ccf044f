package com.naag.docsync.store;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Qdrant only accepts unsigned integers or UUIDs as point ids. Record ids that are neither
 * are mapped to a name-based UUID, which is stable across runs. Numbers with leading zeros
 * (HS codes such as "010121") are not canonical integers and take the UUID route, so they
 * cannot collide with "10121".
 */
public final class PointIds {

    private static final Pattern UNSIGNED = Pattern.compile("0|[1-9]\\d{0,17}");
    private static final Pattern UUID_PATTERN =
            Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

    private PointIds() {}

    /** Returns a {@link Long} or a UUID string. */
    public static Object toPointId(String recordId) {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("Record id must not be blank");
        }
        if (UNSIGNED.matcher(recordId).matches()) {
            return Long.parseLong(recordId);
        }
        if (UUID_PATTERN.matcher(recordId).matches()) {
            return recordId.toLowerCase();
        }
        return UUID.nameUUIDFromBytes(recordId.getBytes(StandardCharsets.UTF_8)).toString();
    }
}

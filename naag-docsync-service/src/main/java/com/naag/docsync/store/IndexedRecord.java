package com.naag.docsync.store;

import com.naag.docsync.embed.SparseVector;
import com.naag.docsync.store.payload.RecordPayload;

import java.util.List;

public record IndexedRecord(
        String id,
        List<Double> denseVector,
        SparseVector sparseVector,
        RecordPayload payload
) {}

package com.shoplens.backend.batch;

import lombok.Value;

/**
 * One submitted URL of a batch. Either {@code jobId} is set or the URL was
 * refused at submission and {@code rejection} holds the reason.
 */
@Value
public class BatchEntry {
    String sourceRef;
    String jobId;
    String rejection;
}

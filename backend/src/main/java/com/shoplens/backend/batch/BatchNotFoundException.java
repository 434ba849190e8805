package com.shoplens.backend.batch;

public class BatchNotFoundException extends RuntimeException {

    public BatchNotFoundException(String batchId) {
        super("Batch analysis not found: " + batchId);
    }
}

package com.shoplens.backend.crawling;

import com.shoplens.backend.model.enums.JobKind;

/**
 * Fetches a page and turns it into a harvested field map.
 */
public interface RetrievalService {

    HarvestedData retrieve(String sourceRef, JobKind kind);
}

package com.shoplens.backend.feedback.service;

import java.util.Map;

/**
 * Best-effort side channel for feedback instrumentation. Calls return
 * nothing and never throw; a lost event does not affect the caller.
 */
public interface FeedbackDiagnostics {

    void record(String event, Map<String, Object> data);
}

package com.apex.gate.service.pipeline;

/**
 * Hand-off point for persisting a finished run. Failures are logged by the caller and never fail the run.
 */
public interface CandidateResultSink {

    void save(CandidateResult result);
}

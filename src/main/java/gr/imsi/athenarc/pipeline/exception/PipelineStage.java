package gr.imsi.athenarc.pipeline.exception;

/**
 * States a request passes through inside the query pipeline. A failure carries
 * the stage that could not be completed.
 */
public enum PipelineStage {
    RECEIVED,
    AUTHORIZED,
    POLICY_APPLIED,
    CACHE_CHECKED,
    CACHE_HIT,
    COMPILED,
    EXECUTING,
    POST_PROCESSED,
    FORMATTED,
    CACHE_WRITTEN
}

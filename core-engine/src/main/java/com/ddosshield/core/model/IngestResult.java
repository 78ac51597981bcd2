package com.ddosshield.core.model;

/**
 * Outcome of handing a {@link FlowEvent} to the ingestion interface.
 */
public enum IngestResult {

    /** Queued for aggregation. */
    ACCEPTED,

    /** Ingestion queue full; the caller should shed or retry later. */
    BUSY,

    /** Rejected by validation and counted. */
    MALFORMED
}

package com.opsdash.common.exception;

import java.util.List;

/**
 * Exception describing a fan-out where some recipients could not be written.
 * The successful part of the batch stays committed.
 */
public final class PartialBatchException extends OpsDashException {

    private final List<String> failedRecipientIds;
    private final int attempted;

    public PartialBatchException(List<String> failedRecipientIds, int attempted) {
        super(failedRecipientIds.size() + " of " + attempted + " recipients could not be notified");
        this.failedRecipientIds = List.copyOf(failedRecipientIds);
        this.attempted = attempted;
    }

    public List<String> getFailedRecipientIds() {
        return failedRecipientIds;
    }

    public int getAttempted() {
        return attempted;
    }

    @Override
    public String getErrorCode() {
        return "PARTIAL_BATCH";
    }
}

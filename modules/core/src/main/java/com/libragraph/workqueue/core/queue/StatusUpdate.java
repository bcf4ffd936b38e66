package com.libragraph.workqueue.core.queue;

/**
 * Fields written alongside a conditional status change, plus optional
 * ownership preconditions.
 *
 * @param expectedOwner      when non-null, the write only matches if {@code owner} equals it
 * @param expectedGeneration when non-null, the write only matches if {@code claim_generation} equals it
 * @param result             JSON result, written on {@link WorkItemStatus#COMPLETED}
 * @param error              failure detail, written on {@link WorkItemStatus#FAILED}
 * @param errorCategory      coarse failure class, written on {@link WorkItemStatus#FAILED}
 */
public record StatusUpdate(
        String expectedOwner,
        Integer expectedGeneration,
        String result,
        String error,
        String errorCategory
) {

    public static StatusUpdate none() {
        return new StatusUpdate(null, null, null, null, null);
    }

    public static StatusUpdate completed(String owner, int generation, String resultJson) {
        return new StatusUpdate(owner, generation, resultJson, null, null);
    }

    public static StatusUpdate failed(String owner, int generation, String error, String errorCategory) {
        return new StatusUpdate(owner, generation, null, error, errorCategory);
    }
}

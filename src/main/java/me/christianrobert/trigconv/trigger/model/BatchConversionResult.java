package me.christianrobert.trigconv.trigger.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results of a batch in submission order, one per trigger, failures included.
 */
public class BatchConversionResult {

    private final List<ConversionResult> results;
    private final int successCount;
    private final int failureCount;

    public BatchConversionResult(List<ConversionResult> results) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        int ok = 0;
        for (ConversionResult result : results) {
            if (result.isSuccess()) {
                ok++;
            }
        }
        this.successCount = ok;
        this.failureCount = results.size() - ok;
    }

    public List<ConversionResult> getResults() {
        return results;
    }

    public int getTotalCount() {
        return results.size();
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public boolean isAllSucceeded() {
        return failureCount == 0;
    }

    @Override
    public String toString() {
        return "BatchConversionResult{total=" + results.size() + ", success=" + successCount
                + ", failed=" + failureCount + "}";
    }
}

package com.companya.ledgersync.model;

/**
 * Size reduction achieved by field filtering, in serialized JSON characters. Observability only.
 */
public record ReductionStats(int originalSize, int filteredSize, int reduction, int reductionPercent) {

    public static ReductionStats of(int originalSize, int filteredSize) {
        int reduction = originalSize - filteredSize;
        int percent = originalSize == 0 ? 0 : Math.round(reduction * 100f / originalSize);
        return new ReductionStats(originalSize, filteredSize, reduction, percent);
    }
}

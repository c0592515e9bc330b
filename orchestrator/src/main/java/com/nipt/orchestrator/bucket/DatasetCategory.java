package com.nipt.orchestrator.bucket;

/**
 * The three namespaces a step code can address inside a dataset.
 *
 * Order of declaration is the lookup order used when resolving a step code:
 * processed steps first, then reports, then masks.
 */
public enum DatasetCategory {
    PROCESSED("steps",     "Processed steps"),
    REPORTED ("reports",   "Reported steps"),
    MASKED   ("datatypes", "Mask data");

    private final String filterKey;
    private final String heading;

    DatasetCategory(String filterKey, String heading) {
        this.filterKey = filterKey;
        this.heading   = heading;
    }

    /** Query key that carries the resolved location for this category. */
    public String filterKey() { return filterKey; }

    public String heading()   { return heading; }

    /** Masks are shared across packages; everything else is filtered by package label. */
    public boolean packageScoped() {
        return this != MASKED;
    }
}

package com.xksgroup.mediadedup.model;

public enum GroupingMode {
    /** Any item with at least one above-threshold match joins the bucket's single group. */
    EDGE_DRIVEN,
    /** One group per connected component of the above-threshold match graph. */
    CONNECTED_COMPONENTS
}

package com.gillianbc.rothprojection.model;

public enum PlanKind {
    /** No conversions applied. */
    BASELINE,
    /** The scenario's conversion plans applied. */
    CONVERSION
}

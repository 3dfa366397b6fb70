package com.gillianbc.rothprojection.model;

public enum Owner {
    PRIMARY,
    SPOUSE
}

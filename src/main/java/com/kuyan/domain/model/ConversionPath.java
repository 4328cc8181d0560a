package com.kuyan.domain.model;

/**
 * How a conversion was resolved against a rate map, in resolution order
 */
public enum ConversionPath {
    IDENTITY,
    DIRECT,
    INVERSE,
    TRIANGULATED,
    MISS
}

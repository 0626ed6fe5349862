package com.mevshield.common.model;

/** Where an {@link Opportunity} entered the engine. */
public enum OpportunitySource {
    DETECTOR,
    EXTERNAL
}

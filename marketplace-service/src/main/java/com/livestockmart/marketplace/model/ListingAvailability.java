package com.livestockmart.marketplace.model;

public enum ListingAvailability {
    AVAILABLE,
    RESERVED    // Claimed by exactly one order until that order is cancelled
}

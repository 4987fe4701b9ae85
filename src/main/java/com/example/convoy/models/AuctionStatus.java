package com.example.convoy.models;

/**
 * Auction statuses the convoy feed cares about. Anything else maps to
 * {@link #UNKNOWN}.
 */
public enum AuctionStatus {

    PENDING_VERIFICATION("pending.verification"),
    COMPLETE("complete"),
    CANCELLED("cancelled"),
    UNSUCCESSFUL("unsuccessful"),
    UNKNOWN(null);

    private final String value;

    AuctionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AuctionStatus fromValue(String value) {
        for (AuctionStatus status : values()) {
            if (status.value != null && status.value.equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}

package com.epcid.domain;

public enum DurationBucket {
    LESS_THAN_DAY,
    ONE_TO_THREE_DAYS,
    FOUR_TO_SEVEN_DAYS,
    MORE_THAN_WEEK
}

package com.districtintel.engine.service;

public enum RejectionReason {
    /** districtId absent, blank, or not a string in the source row */
    MISSING_DISTRICT_ID
}

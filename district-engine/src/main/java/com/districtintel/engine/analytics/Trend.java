package com.districtintel.engine.analytics;

public enum Trend {
    IMPROVING, DECLINING
}

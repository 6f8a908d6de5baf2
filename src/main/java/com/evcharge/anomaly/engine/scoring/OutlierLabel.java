package com.evcharge.anomaly.engine.scoring;

public enum OutlierLabel {
    NORMAL,
    OUTLIER
}

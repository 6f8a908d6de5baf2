package com.evcharge.anomaly.model;

import java.util.List;

/**
 * Column names of the canonical session schema. Uploaded files are mapped onto these
 * names by the column standardizer before any detector reads them.
 */
public final class CanonicalColumns {

    public static final String SESSION_ID = "session_id";
    public static final String USER_ID = "user_id";
    public static final String CHARGER_ID = "charger_id";
    public static final String START_TIME = "start_time";
    public static final String END_TIME = "end_time";
    public static final String DURATION = "duration";
    public static final String ENERGY_KWH = "energy_kWh";
    public static final String AMOUNT_INR = "amount_INR";
    public static final String IP_ADDRESS = "ip_address";
    public static final String GEO_LOCATION = "geo_location";
    public static final String CPU_USAGE_PERCENT = "cpu_usage_percent";
    public static final String PACKETS_PER_SEC = "packets_per_sec";

    // Identity and time columns every run needs
    public static final List<String> ESSENTIAL = List.of(SESSION_ID, START_TIME, END_TIME, USER_ID);

    private CanonicalColumns() {}
}

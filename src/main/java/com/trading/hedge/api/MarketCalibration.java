package com.trading.hedge.api;

import java.util.Map;

/** Registered calibration of a price process. */
public record MarketCalibration(String id, String priceProcessName, Map<String, Object> parameters) {
}

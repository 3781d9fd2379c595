/**
 * Anomaly detection: pluggable strategies over measure time series and the
 * engine that runs a monitor from fetch to persistence.
 *
 * <p>
 * Supported strategy types:
 * </p>
 * <ul>
 * <li>{@code threshold}: static min / max bounds</li>
 * <li>{@code relative_delta}: period-over-period percentage change</li>
 * <li>{@code z_score}: distance from the series mean in standard
 * deviations</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.warehousesentinel.core.detection;

package com.serpintel.common.alert;

import java.util.List;

/**
 * @param alerts      sorted alerts, cut at the requested limit
 * @param totalAlerts alerts produced before the cut
 */
public record AlertReport(List<VolatilityAlert> alerts, int totalAlerts) {

    public int alertCount() {
        return alerts.size();
    }
}

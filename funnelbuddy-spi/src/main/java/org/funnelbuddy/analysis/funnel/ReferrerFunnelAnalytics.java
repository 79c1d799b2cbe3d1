package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonProperty;

public class ReferrerFunnelAnalytics {
    public static final String DIRECT = "direct";

    @JsonProperty("referrer")
    public final String referrer;
    @JsonProperty("referrer_domain")
    public final String referrerDomain;
    @JsonProperty("analytics")
    public final FunnelAnalyticsResult analytics;

    public ReferrerFunnelAnalytics(String referrer, String referrerDomain, FunnelAnalyticsResult analytics) {
        this.referrer = referrer;
        this.referrerDomain = referrerDomain;
        this.analytics = analytics;
    }
}

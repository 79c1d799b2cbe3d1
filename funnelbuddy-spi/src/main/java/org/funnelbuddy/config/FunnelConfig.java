package org.funnelbuddy.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import javax.validation.constraints.Min;

public class FunnelConfig {
    private int defaultRangeDays = 30;
    private int autocompleteRangeDays = 90;

    @Min(1)
    public int getDefaultRangeDays() {
        return defaultRangeDays;
    }

    @Config("funnel.default-range-days")
    @ConfigDescription("Number of days analyzed when the request has no date range")
    public FunnelConfig setDefaultRangeDays(int defaultRangeDays) {
        this.defaultRangeDays = defaultRangeDays;
        return this;
    }

    @Min(1)
    public int getAutocompleteRangeDays() {
        return autocompleteRangeDays;
    }

    @Config("funnel.autocomplete-range-days")
    public FunnelConfig setAutocompleteRangeDays(int autocompleteRangeDays) {
        this.autocompleteRangeDays = autocompleteRangeDays;
        return this;
    }
}

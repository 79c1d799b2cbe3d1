package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Values seen in the event store that the funnel builder offers as step targets and filter values.
 */
public class FunnelAutocompleteData {
    @JsonProperty
    public final List<String> customEvents;
    @JsonProperty
    public final List<String> pagePaths;
    @JsonProperty
    public final List<String> browsers;
    @JsonProperty
    public final List<String> operatingSystems;
    @JsonProperty
    public final List<String> countries;
    @JsonProperty
    public final List<String> deviceTypes;
    @JsonProperty
    public final List<String> utmSources;
    @JsonProperty
    public final List<String> utmMediums;
    @JsonProperty
    public final List<String> utmCampaigns;

    public FunnelAutocompleteData(List<String> customEvents, List<String> pagePaths, List<String> browsers,
                                  List<String> operatingSystems, List<String> countries, List<String> deviceTypes,
                                  List<String> utmSources, List<String> utmMediums, List<String> utmCampaigns) {
        this.customEvents = ImmutableList.copyOf(customEvents);
        this.pagePaths = ImmutableList.copyOf(pagePaths);
        this.browsers = ImmutableList.copyOf(browsers);
        this.operatingSystems = ImmutableList.copyOf(operatingSystems);
        this.countries = ImmutableList.copyOf(countries);
        this.deviceTypes = ImmutableList.copyOf(deviceTypes);
        this.utmSources = ImmutableList.copyOf(utmSources);
        this.utmMediums = ImmutableList.copyOf(utmMediums);
        this.utmCampaigns = ImmutableList.copyOf(utmCampaigns);
    }
}

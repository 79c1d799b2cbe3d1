package org.funnelbuddy.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

import javax.validation.constraints.NotNull;

import java.util.Set;

/**
 * Layout of the time-series event table that funnel steps are matched against.
 */
public class EventStoreConfig {
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private String table = "analytics.events";
    private String websiteColumn = "client_id";
    private String sessionColumn = "session_id";
    private String timeColumn = "time";
    private String eventNameColumn = "event_name";
    private String pathColumn = "path";
    private String referrerColumn = "referrer";
    private String pageViewEventName = "screen_view";
    private Set<String> filterableColumns = ImmutableSet.of(
            "path", "referrer", "browser_name", "os_name", "country", "region", "city",
            "device_type", "language", "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content");

    @NotNull
    public String getTable() {
        return table;
    }

    @Config("event-store.table")
    @ConfigDescription("Schema-qualified table that holds the raw events")
    public EventStoreConfig setTable(String table) {
        this.table = table;
        return this;
    }

    @NotNull
    public String getWebsiteColumn() {
        return websiteColumn;
    }

    @Config("event-store.website-column")
    public EventStoreConfig setWebsiteColumn(String websiteColumn) {
        this.websiteColumn = websiteColumn;
        return this;
    }

    @NotNull
    public String getSessionColumn() {
        return sessionColumn;
    }

    @Config("event-store.session-column")
    public EventStoreConfig setSessionColumn(String sessionColumn) {
        this.sessionColumn = sessionColumn;
        return this;
    }

    @NotNull
    public String getTimeColumn() {
        return timeColumn;
    }

    @Config("event-store.time-column")
    public EventStoreConfig setTimeColumn(String timeColumn) {
        this.timeColumn = timeColumn;
        return this;
    }

    @NotNull
    public String getEventNameColumn() {
        return eventNameColumn;
    }

    @Config("event-store.event-name-column")
    public EventStoreConfig setEventNameColumn(String eventNameColumn) {
        this.eventNameColumn = eventNameColumn;
        return this;
    }

    @NotNull
    public String getPathColumn() {
        return pathColumn;
    }

    @Config("event-store.path-column")
    public EventStoreConfig setPathColumn(String pathColumn) {
        this.pathColumn = pathColumn;
        return this;
    }

    @NotNull
    public String getReferrerColumn() {
        return referrerColumn;
    }

    @Config("event-store.referrer-column")
    public EventStoreConfig setReferrerColumn(String referrerColumn) {
        this.referrerColumn = referrerColumn;
        return this;
    }

    @NotNull
    public String getPageViewEventName() {
        return pageViewEventName;
    }

    @Config("event-store.page-view-event-name")
    @ConfigDescription("Event name the tracker uses for page views")
    public EventStoreConfig setPageViewEventName(String pageViewEventName) {
        this.pageViewEventName = pageViewEventName;
        return this;
    }

    public Set<String> getFilterableColumns() {
        return filterableColumns;
    }

    @Config("event-store.filterable-columns")
    @ConfigDescription("Comma separated list of columns that funnel filters and step conditions may reference")
    public EventStoreConfig setFilterableColumns(String filterableColumns) {
        this.filterableColumns = ImmutableSet.copyOf(LIST_SPLITTER.split(filterableColumns));
        return this;
    }
}

package org.funnelbuddy.analysis.funnel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.List;

import static org.funnelbuddy.util.ValidationUtil.checkNotNull;

public class FunnelDefinition {
    public final String id;
    public final String websiteId;
    public final String name;
    public final String description;
    public final List<FunnelStep> steps;
    public final List<FunnelFilter> filters;
    public final boolean isActive;
    public final Instant createdAt;
    public final Instant updatedAt;
    public final Instant deletedAt;

    @JsonCreator
    public FunnelDefinition(@JsonProperty("id") String id,
                            @JsonProperty("websiteId") String websiteId,
                            @JsonProperty("name") String name,
                            @JsonProperty("description") String description,
                            @JsonProperty("steps") List<FunnelStep> steps,
                            @JsonProperty("filters") List<FunnelFilter> filters,
                            @JsonProperty("isActive") boolean isActive,
                            @JsonProperty("createdAt") Instant createdAt,
                            @JsonProperty("updatedAt") Instant updatedAt,
                            @JsonProperty("deletedAt") Instant deletedAt) {
        this.id = checkNotNull(id, "id");
        this.websiteId = checkNotNull(websiteId, "websiteId");
        this.name = name;
        this.description = description;
        this.steps = steps == null ? ImmutableList.of() : ImmutableList.copyOf(steps);
        this.filters = filters == null ? ImmutableList.of() : ImmutableList.copyOf(filters);
        this.isActive = isActive;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.deletedAt = deletedAt;
    }

    public FunnelDefinition(String id, String websiteId, String name, List<FunnelStep> steps, List<FunnelFilter> filters) {
        this(id, websiteId, name, null, steps, filters, true, null, null, null);
    }

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAt != null;
    }
}

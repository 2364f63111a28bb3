package com.ospicorp.salesinsights.artifact;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactInfo(
    ArtifactKind kind,
    String label,
    String path,
    boolean present,
    @JsonProperty("last_modified") Instant lastModified,
    ArtifactStatus status,
    String detail
) {}

package com.example.enterprise.client.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** {@code expires} is always written as an ISO-8601 string, whatever the mapper's date settings. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActivateRequest(
    String activationCode, @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expires) {}

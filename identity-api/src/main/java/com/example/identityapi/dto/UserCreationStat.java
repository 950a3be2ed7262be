package com.example.identityapi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Accounts created on one calendar day.
 */
public record UserCreationStat(
    @JsonProperty("date")
    LocalDate date,

    @JsonProperty("count")
    Long count
) {
}

package com.example.identityapi.dto;

import java.util.List;

public record UserCreationStatsResponse(List<UserCreationStat> userCreationStats) {
}

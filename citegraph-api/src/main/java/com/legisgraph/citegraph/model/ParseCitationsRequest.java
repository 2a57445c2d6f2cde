package com.legisgraph.citegraph.model;

import jakarta.validation.constraints.NotNull;

public record ParseCitationsRequest(@NotNull String text) {
}

package com.legisgraph.citegraph.model;

import java.time.LocalDate;

public record LawLink(String lawId, String title, LocalDate enactedDate, String statutesAtLarge, String relationship) {
}

package com.traveltech.opsmonitor.core.model;

public record TermDelta(String term, int delta) {
}

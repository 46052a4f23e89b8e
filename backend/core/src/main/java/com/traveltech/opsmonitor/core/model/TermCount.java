package com.traveltech.opsmonitor.core.model;

public record TermCount(String term, int count) {
}

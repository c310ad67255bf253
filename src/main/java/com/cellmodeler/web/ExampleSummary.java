package com.cellmodeler.web;

public record ExampleSummary(String id, String name) {
}

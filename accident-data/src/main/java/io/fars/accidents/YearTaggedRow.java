package io.fars.accidents;

public record YearTaggedRow(int month, int year) {}

package com.example.logistics.model;

public record ClassMetrics(
    double precision,
    double recall,
    double f1,
    int support
) {}

package com.example.logistics.model;

public record TrainingExample(String text, Intent intent) {}

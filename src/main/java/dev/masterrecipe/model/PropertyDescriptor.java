package dev.masterrecipe.model;

public record PropertyDescriptor(
    String name,
    String realizedBy // nullable
) {}

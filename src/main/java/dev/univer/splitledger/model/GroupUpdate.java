package dev.univer.splitledger.model;

/** Partial update of a group, null fields are left unchanged. */
public record GroupUpdate(String name, String description, String currencyCode) {}

package com.example.accessgate.model;

/**
 * Declares that {@code fieldName} exists on {@code entityType} in the given tier.
 */
public record FieldDefinition(String entityType, String fieldName, FieldTier tier) {
}

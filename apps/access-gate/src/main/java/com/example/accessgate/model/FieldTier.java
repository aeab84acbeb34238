package com.example.accessgate.model;

public enum FieldTier {
    CORE,
    PLATFORM,
    TENANT
}

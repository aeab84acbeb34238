package com.example.accessgate.model;

public enum FieldAction {
    READ,
    WRITE,
    HIDDEN
}

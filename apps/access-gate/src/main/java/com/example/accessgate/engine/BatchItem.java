package com.example.accessgate.engine;

import com.example.accessgate.model.ResourceTarget;

public record BatchItem(ResourceTarget resource, String action) {
}

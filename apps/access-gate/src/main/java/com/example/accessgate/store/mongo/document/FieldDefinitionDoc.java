package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

// ID format: "{entityType}/{tier}/{fieldName}"
@Data
@Builder
@Document(collection = "field_definitions")
public class FieldDefinitionDoc {

    @Id
    private String id;

    @Indexed
    private String entityType;

    private String fieldName;

    private String tier;
}

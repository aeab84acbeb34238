package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Map;
import java.util.Set;

@Data
@Builder
@Document(collection = "principals")
public class PrincipalDoc {

    @Id
    private String id;

    private String tenantId;

    private boolean serviceAccount;

    private Map<String, Object> attributes;

    @Indexed
    private Set<String> groupIds;

    private boolean active;
}

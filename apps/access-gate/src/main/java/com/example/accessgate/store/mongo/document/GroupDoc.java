package com.example.accessgate.store.mongo.document;

import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Set;

@Data
@Builder
@Document(collection = "groups")
public class GroupDoc {

    @Id
    private String id;

    private String tenantId;

    @Indexed
    private String parentId;

    @Indexed
    private Set<String> roleIds;

    private boolean active;
}

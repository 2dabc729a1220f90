package com.example.kanban.saga;

import java.util.List;

/**
 * @param assignTags Ids of existing tags to link to every created task
 * @param createDependencies Whether each task depends on the one created before it
 */
public record BulkCreateOptions(List<String> assignTags, boolean createDependencies) {

    public BulkCreateOptions {
        assignTags = assignTags != null ? List.copyOf(assignTags) : List.of();
    }

    public static BulkCreateOptions none() {
        return new BulkCreateOptions(List.of(), false);
    }
}

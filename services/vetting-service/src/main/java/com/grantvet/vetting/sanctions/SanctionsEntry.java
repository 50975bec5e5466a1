package com.grantvet.vetting.sanctions;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw sanctions list record: a primary name plus any registered aliases.
 */
@Value
@Builder
public class SanctionsEntry {

    public static final String ENTITY_TYPE = "Entity";

    String entityNumber;
    String primaryName;
    String entityType;
    String program;
    @Builder.Default
    List<String> aliases = List.of();

    public boolean isEntity() {
        return ENTITY_TYPE.equalsIgnoreCase(entityType);
    }
}

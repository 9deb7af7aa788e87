package com.aegis.records;

import com.aegis.validation.SchemaRegistry;
import java.util.List;

/**
 * Registers every space record kind, embedded kinds before the kinds that embed them.
 */
public final class SpaceRecordCatalog {

    /** All kinds in registration order. */
    public static final List<String> KINDS = List.of(
            StationSchema.KIND, ContactReportSchema.KIND, CrewMemberSchema.KIND, MissionSchema.KIND);

    private SpaceRecordCatalog() {
        // utility class
    }

    /**
     * Defines all space record kinds in {@code registry}.
     *
     * @throws com.aegis.validation.SchemaDefinitionException if any kind is already defined
     */
    public static SchemaRegistry registerAll(SchemaRegistry registry) {
        registry.define(StationSchema.definition());
        registry.define(ContactReportSchema.definition());
        registry.define(CrewMemberSchema.definition());
        registry.define(MissionSchema.definition());
        return registry;
    }

    /** A new registry holding exactly the space record kinds. */
    public static SchemaRegistry newRegistry() {
        return registerAll(new SchemaRegistry());
    }
}

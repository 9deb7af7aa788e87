package com.aegis.records;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.records.testing.SampleRecords;
import com.aegis.validation.SchemaDefinitionException;
import com.aegis.validation.SchemaRegistry;
import com.aegis.validation.ValidationEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SpaceRecordCatalog")
class SpaceRecordCatalogTest {

    @Test
    @DisplayName("registers all four kinds")
    void registersAll() {
        SchemaRegistry registry = SpaceRecordCatalog.newRegistry();

        assertThat(registry.kinds()).containsExactlyInAnyOrderElementsOf(SpaceRecordCatalog.KINDS);
        assertThat(registry.lookup(MissionSchema.KIND).rules()).containsExactly(MissionRule.values());
    }

    @Test
    @DisplayName("registering twice fails")
    void twice() {
        SchemaRegistry registry = SpaceRecordCatalog.newRegistry();

        assertThatThrownBy(() -> SpaceRecordCatalog.registerAll(registry))
                .isInstanceOf(SchemaDefinitionException.class);
    }

    @Test
    @DisplayName("crew members validate on their own")
    void crewMemberStandalone() {
        var engine = ValidationEngine.builder(SpaceRecordCatalog.newRegistry()).build();
        var raw = SampleRecords.crewMember("C01", "Alice", "officer", 6);

        CrewMember member = CrewMember.from(engine.validate(CrewMemberSchema.KIND, raw).orElseThrow());

        assertThat(member.rank()).isEqualTo(Rank.OFFICER);
        assertThat(member.active()).isTrue();
    }

    @Test
    @DisplayName("views refuse records of another kind")
    void viewKindCheck() {
        var engine = ValidationEngine.builder(SpaceRecordCatalog.newRegistry()).build();
        var station = engine.validate(StationSchema.KIND, SampleRecords.station()).orElseThrow();

        assertThatThrownBy(() -> Mission.from(station))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("expected a 'mission' record, got 'station'");
    }
}

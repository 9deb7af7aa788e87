package com.aegis.records.testing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw inputs for tests: one valid input per record kind, plus helpers to derive invalid ones.
 * <p>
 * Lives in src/main so other modules can use it from their test scope through a regular
 * dependency. Every method returns a fresh, mutable map.
 */
public final class SampleRecords {

    private SampleRecords() {
        // utility class
    }

    /** A valid station (the ISS). */
    public static Map<String, Object> station() {
        var raw = new LinkedHashMap<String, Object>();
        raw.put("station_id", "ISS001");
        raw.put("name", "International Space Station");
        raw.put("crew_size", 6);
        raw.put("power_level", 85.5);
        raw.put("oxygen_level", 92.3);
        raw.put("last_maintenance", "2024-02-01T10:30:00");
        raw.put("is_operational", true);
        raw.put("notes", "All systems nominal.");
        return raw;
    }

    /** A valid radio contact with a strong signal and a message. */
    public static Map<String, Object> contactReport() {
        var raw = new LinkedHashMap<String, Object>();
        raw.put("contact_id", "AC_2024_001");
        raw.put("timestamp", "2024-06-01T14:30:00");
        raw.put("location", "Area 51, Nevada");
        raw.put("contact_type", "radio");
        raw.put("signal_strength", 8.5);
        raw.put("duration_minutes", 45);
        raw.put("witness_count", 5);
        raw.put("message_received", "Greetings from Zeta Reticuli");
        raw.put("is_verified", false);
        return raw;
    }

    /** A valid crew member. */
    public static Map<String, Object> crewMember(String memberId, String name, String rank, int yearsExperience) {
        var raw = new LinkedHashMap<String, Object>();
        raw.put("member_id", memberId);
        raw.put("name", name);
        raw.put("rank", rank);
        raw.put("age", 35);
        raw.put("specialization", "engineering");
        raw.put("years_experience", yearsExperience);
        raw.put("is_active", true);
        return raw;
    }

    /** A commander and an officer, both experienced. */
    public static List<Map<String, Object>> crewWithLeader() {
        var crew = new ArrayList<Map<String, Object>>();
        var commander = crewMember("C03", "Sarah Connor", "commander", 20);
        commander.put("age", 45);
        commander.put("specialization", "mission command");
        crew.add(commander);
        var officer = crewMember("C04", "John Smith", "officer", 29);
        officer.put("age", 29);
        crew.add(officer);
        return crew;
    }

    /** An officer and a lieutenant: no captain or commander. */
    public static List<Map<String, Object>> crewWithoutLeader() {
        var crew = new ArrayList<Map<String, Object>>();
        crew.add(crewMember("C01", "Alice", "officer", 6));
        var bob = crewMember("C02", "Bob", "lieutenant", 10);
        bob.put("specialization", "navigation");
        crew.add(bob);
        return crew;
    }

    /** A valid 900-day Mars mission led by a commander. */
    public static Map<String, Object> mission() {
        var raw = new LinkedHashMap<String, Object>();
        raw.put("mission_id", "M2026_OK");
        raw.put("mission_name", "Mars Exploration Mission");
        raw.put("destination", "Mars");
        raw.put("launch_date", "2026-03-15T09:00:00Z");
        raw.put("duration_days", 900);
        raw.put("crew", crewWithLeader());
        raw.put("budget_millions", 2500.0);
        return raw;
    }

    /** Copy of {@code raw} with one field replaced (or added). */
    public static Map<String, Object> with(Map<String, Object> raw, String field, Object value) {
        var copy = new LinkedHashMap<>(raw);
        copy.put(field, value);
        return copy;
    }

    /** Copy of {@code raw} with one field removed. */
    public static Map<String, Object> without(Map<String, Object> raw, String field) {
        var copy = new LinkedHashMap<>(raw);
        copy.remove(field);
        return copy;
    }
}

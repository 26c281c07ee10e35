package com.glottocatalog.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.glottocatalog.model.Doctype;
import com.glottocatalog.model.Languoid;
import com.glottocatalog.model.MacroArea;
import com.glottocatalog.model.Provider;
import com.glottocatalog.model.Reference;
import com.glottocatalog.model.ReferenceField;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.io.UncheckedIOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of canonical references and their links to vocabularies and languoids.
 * References are created and updated in place, never deleted.
 */
@Repository
public class ReferenceRepository {

    private static final TypeReference<LinkedHashMap<String, String>> JSONDATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final RowMapper<Reference> referenceMapper = this::mapReference;

    public ReferenceRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a reference with its macro-areas, providers, doctypes and languoids.
     */
    public Optional<Reference> findByPk(Long pk) {
        List<Reference> results = jdbc.query("SELECT * FROM bib_ref WHERE pk = ?", referenceMapper, pk);
        if (results.isEmpty()) {
            return Optional.empty();
        }
        Reference reference = results.get(0);
        reference.setMacroareas(findMacroAreas(pk));
        reference.setProviders(findProviders(pk));
        reference.setDoctypes(findDoctypes(pk));
        reference.setLanguoids(findLanguoids(pk));
        return Optional.of(reference);
    }

    public Set<Long> findAllPks() {
        return new HashSet<>(jdbc.queryForList("SELECT pk FROM bib_ref", Long.class));
    }

    public void insert(Reference reference) {
        StringBuilder columns = new StringBuilder("pk, id, name, description, doctypes_str, providers_str, jsondata, updated");
        StringBuilder placeholders = new StringBuilder("?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP");
        List<Object> params = new ArrayList<>();
        params.add(reference.getPk());
        params.add(reference.getId());
        params.add(reference.getName());
        params.add(reference.getDescription());
        params.add(reference.getDoctypesStr());
        params.add(reference.getProvidersStr());
        params.add(toJson(reference.getJsondata()));
        for (ReferenceField field : ReferenceField.values()) {
            columns.append(", ").append(field.column());
            placeholders.append(", ?");
            params.add(field.get(reference));
        }
        jdbc.update("INSERT INTO bib_ref (" + columns + ") VALUES (" + placeholders + ")", params.toArray());
    }

    public void updateField(Long pk, ReferenceField field, Object value) {
        // column names come from the enum, never from input
        jdbc.update("UPDATE bib_ref SET " + field.column() + " = ?, updated = CURRENT_TIMESTAMP WHERE pk = ?", value, pk);
    }

    public void updateDescription(Long pk, String description) {
        jdbc.update("UPDATE bib_ref SET description = ? WHERE pk = ?", description, pk);
    }

    public void updateJsondata(Long pk, Map<String, String> jsondata) {
        jdbc.update("UPDATE bib_ref SET jsondata = ? WHERE pk = ?", toJson(jsondata), pk);
    }

    public void updateSummaries(Long pk, String doctypesStr, String providersStr) {
        jdbc.update(
            "UPDATE bib_ref SET doctypes_str = ?, providers_str = ?, updated = CURRENT_TIMESTAMP WHERE pk = ?",
            doctypesStr, providersStr, pk
        );
    }

    // ========== RELATIONSHIPS ==========

    public List<MacroArea> findMacroAreas(Long pk) {
        return jdbc.query("""
            SELECT m.* FROM macroarea m
            JOIN bib_ref_macroarea rm ON rm.macroarea_id = m.id
            WHERE rm.ref_pk = ?
            ORDER BY m.id
            """, VocabularyRepository.MACROAREA_MAPPER, pk);
    }

    public List<Provider> findProviders(Long pk) {
        return jdbc.query("""
            SELECT p.* FROM provider p
            JOIN bib_ref_provider rp ON rp.provider_id = p.id
            WHERE rp.ref_pk = ?
            ORDER BY p.id
            """, VocabularyRepository.PROVIDER_MAPPER, pk);
    }

    public List<Doctype> findDoctypes(Long pk) {
        return jdbc.query("""
            SELECT d.* FROM doctype d
            JOIN bib_ref_doctype rd ON rd.doctype_id = d.id
            WHERE rd.ref_pk = ?
            ORDER BY d.ord, d.id
            """, VocabularyRepository.DOCTYPE_MAPPER, pk);
    }

    public List<Languoid> findLanguoids(Long pk) {
        return jdbc.query("""
            SELECT l.* FROM languoid l
            JOIN bib_ref_languoid rl ON rl.languoid_pk = l.pk
            WHERE rl.ref_pk = ?
            ORDER BY l.name, l.id
            """, LanguoidRepository.LANGUOID_MAPPER, pk);
    }

    public void addMacroArea(Long pk, MacroArea macroArea) {
        jdbc.update("INSERT INTO bib_ref_macroarea (ref_pk, macroarea_id) VALUES (?, ?)", pk, macroArea.id());
    }

    public void addProvider(Long pk, Provider provider) {
        jdbc.update("INSERT INTO bib_ref_provider (ref_pk, provider_id) VALUES (?, ?)", pk, provider.id());
    }

    public void addDoctype(Long pk, Doctype doctype) {
        jdbc.update("INSERT INTO bib_ref_doctype (ref_pk, doctype_id) VALUES (?, ?)", pk, doctype.id());
    }

    public void addLanguoid(Long pk, Languoid languoid) {
        jdbc.update("INSERT INTO bib_ref_languoid (ref_pk, languoid_pk) VALUES (?, ?)", pk, languoid.pk());
    }

    // ========== MAPPING ==========

    private Reference mapReference(ResultSet rs, int rowNum) throws SQLException {
        Reference reference = new Reference(rs.getLong("pk"));
        reference.setId(rs.getString("id"));
        reference.setName(rs.getString("name"));
        reference.setDescription(rs.getString("description"));
        reference.setDoctypesStr(rs.getString("doctypes_str"));
        reference.setProvidersStr(rs.getString("providers_str"));
        reference.setJsondata(fromJson(rs.getString("jsondata")));
        for (ReferenceField field : ReferenceField.values()) {
            if (field.type() == Integer.class) {
                field.set(reference, rs.getObject(field.column()) != null ? rs.getInt(field.column()) : null);
            } else {
                field.set(reference, rs.getString(field.column()));
            }
        }
        return reference;
    }

    private String toJson(Map<String, String> jsondata) {
        try {
            return objectMapper.writeValueAsString(jsondata != null ? jsondata : Map.of());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise reference jsondata", e);
        }
    }

    private Map<String, String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, JSONDATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read reference jsondata", e);
        }
    }
}

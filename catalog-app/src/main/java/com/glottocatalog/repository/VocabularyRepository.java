package com.glottocatalog.repository;

import com.glottocatalog.model.Doctype;
import com.glottocatalog.model.MacroArea;
import com.glottocatalog.model.Provider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Macro-areas, providers and doctypes: small vocabularies with slug identity.
 */
@Repository
public class VocabularyRepository {

    private final JdbcTemplate jdbc;

    static final RowMapper<MacroArea> MACROAREA_MAPPER = (rs, rowNum) -> new MacroArea(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("description")
    );

    static final RowMapper<Provider> PROVIDER_MAPPER = (rs, rowNum) -> new Provider(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("abbr"),
        rs.getString("url")
    );

    static final RowMapper<Doctype> DOCTYPE_MAPPER = (rs, rowNum) -> new Doctype(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("abbr"),
        rs.getObject("ord") != null ? rs.getInt("ord") : null
    );

    public VocabularyRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<MacroArea> findAllMacroAreas() {
        return jdbc.query("SELECT * FROM macroarea ORDER BY id", MACROAREA_MAPPER);
    }

    public List<Provider> findAllProviders() {
        return jdbc.query("SELECT * FROM provider ORDER BY id", PROVIDER_MAPPER);
    }

    public List<Doctype> findAllDoctypes() {
        return jdbc.query("SELECT * FROM doctype ORDER BY ord, id", DOCTYPE_MAPPER);
    }

    public Optional<Provider> findProvider(String id) {
        List<Provider> results = jdbc.query("SELECT * FROM provider WHERE id = ?", PROVIDER_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public void insertProvider(Provider provider) {
        jdbc.update(
            "INSERT INTO provider (id, name, description, abbr, url) VALUES (?, ?, ?, ?, ?)",
            provider.id(), provider.name(), provider.description(), provider.abbr(), provider.url()
        );
    }

    public void updateProvider(Provider provider) {
        jdbc.update(
            "UPDATE provider SET name = ?, description = ?, abbr = ?, url = ? WHERE id = ?",
            provider.name(), provider.description(), provider.abbr(), provider.url(), provider.id()
        );
    }
}

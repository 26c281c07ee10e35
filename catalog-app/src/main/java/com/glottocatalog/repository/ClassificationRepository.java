package com.glottocatalog.repository;

import com.glottocatalog.model.CitedReference;
import com.glottocatalog.model.Classification;
import com.glottocatalog.model.ClassificationKind;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ClassificationRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<CitedReference> CITED_MAPPER = (rs, rowNum) -> new CitedReference(
        rs.getLong("pk"),
        rs.getString("name"),
        rs.getObject("year_int") != null ? rs.getInt("year_int") : null,
        rs.getString("description")
    );

    public ClassificationRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Classification> find(Long languoidPk, ClassificationKind kind) {
        List<String> descriptions = jdbc.query(
            "SELECT description FROM classification WHERE languoid_pk = ? AND kind = ?",
            (rs, rowNum) -> rs.getString("description"),
            languoidPk, kind.code()
        );
        if (descriptions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Classification(languoidPk, kind, descriptions.get(0), findReferences(languoidPk, kind)));
    }

    public List<CitedReference> findReferences(Long languoidPk, ClassificationKind kind) {
        return jdbc.query("""
            SELECT r.pk, r.name, r.year_int, r.description FROM bib_ref r
            JOIN classification_ref cr ON cr.ref_pk = r.pk
            WHERE cr.languoid_pk = ? AND cr.kind = ?
            ORDER BY r.pk
            """, CITED_MAPPER, languoidPk, kind.code());
    }
}

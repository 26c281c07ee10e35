package com.glottocatalog.repository;

import com.glottocatalog.model.Languoid;
import com.glottocatalog.model.LanguoidLevel;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the languoid tree. The tree, including the closure table, is written by
 * the classification loader and never modified here.
 */
@Repository
public class LanguoidRepository {

    private final JdbcTemplate jdbc;

    static final RowMapper<Languoid> LANGUOID_MAPPER = (rs, rowNum) -> new Languoid(
        rs.getLong("pk"),
        rs.getString("id"),
        rs.getString("name"),
        LanguoidLevel.fromValue(rs.getString("level")),
        rs.getString("hid"),
        rs.getBoolean("active"),
        rs.getBoolean("bookkeeping"),
        rs.getObject("father_pk") != null ? rs.getLong("father_pk") : null,
        rs.getObject("family_pk") != null ? rs.getLong("family_pk") : null,
        rs.getString("macroareas"),
        rs.getObject("child_language_count") != null ? rs.getInt("child_language_count") : null
    );

    private static final RowMapper<TreeRow> TREE_ROW_MAPPER = (rs, rowNum) -> new TreeRow(
        rs.getObject("father_pk") != null ? rs.getLong("father_pk") : null,
        rs.getLong("pk"),
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("hid"),
        LanguoidLevel.fromValue(rs.getString("level")),
        rs.getObject("child_language_count") != null ? rs.getInt("child_language_count") : null,
        rs.getInt("depth")
    );

    public LanguoidRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Languoid> findByPk(Long pk) {
        List<Languoid> results = jdbc.query("SELECT * FROM languoid WHERE pk = ?", LANGUOID_MAPPER, pk);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Languoid> findById(String id) {
        List<Languoid> results = jdbc.query("SELECT * FROM languoid WHERE id = ?", LANGUOID_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Languoid> findAll() {
        return jdbc.query("SELECT * FROM languoid ORDER BY pk", LANGUOID_MAPPER);
    }

    public List<Languoid> findChildren(Long pk) {
        return jdbc.query("SELECT * FROM languoid WHERE father_pk = ? ORDER BY name, id", LANGUOID_MAPPER, pk);
    }

    /**
     * Ancestors ordered by distance, from the direct parent to the top-level family.
     */
    public List<Languoid> findAncestors(Long pk) {
        return jdbc.query("""
            SELECT l.* FROM languoid l
            JOIN treeclosuretable t ON t.parent_pk = l.pk AND t.depth > 0
            WHERE t.child_pk = ?
            ORDER BY t.depth
            """, LANGUOID_MAPPER, pk);
    }

    /**
     * All closure descendants of {@code rootPk}, the root included, ordered by depth then name.
     */
    public List<TreeRow> findSubtreeRows(Long rootPk) {
        return jdbc.query("""
            SELECT l.father_pk, l.pk, l.id, l.name, l.hid, l.level, l.child_language_count, t.depth
            FROM languoid l
            JOIN treeclosuretable t ON t.child_pk = l.pk
            WHERE t.parent_pk = ?
            ORDER BY t.depth, l.name
            """, TREE_ROW_MAPPER, rootPk);
    }

    /**
     * Maps the pk of every languoid that has ancestors to the pk of its deepest ancestor.
     */
    public Map<Long, Long> findDeepestAncestors() {
        Map<Long, Long> roots = new HashMap<>();
        jdbc.query("""
            SELECT t.child_pk, t.parent_pk FROM treeclosuretable t
            WHERE t.depth > 0
            AND t.depth = (SELECT MAX(t2.depth) FROM treeclosuretable t2 WHERE t2.child_pk = t.child_pk)
            """, (RowCallbackHandler) rs -> roots.put(rs.getLong("child_pk"), rs.getLong("parent_pk")));
        return roots;
    }

    public record TreeRow(
        Long fatherPk,
        Long pk,
        String id,
        String name,
        String hid,
        LanguoidLevel level,
        Integer childLanguageCount,
        int depth
    ) {}
}

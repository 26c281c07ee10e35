package com.glottocatalog.service;

import com.glottocatalog.model.CitedReference;
import com.glottocatalog.model.Classification;
import com.glottocatalog.model.ClassificationKind;
import com.glottocatalog.model.Languoid;
import com.glottocatalog.model.LanguoidLevel;
import com.glottocatalog.repository.ClassificationRepository;
import com.glottocatalog.repository.LanguoidRepository;
import com.glottocatalog.repository.LanguoidRepository.TreeRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class LanguoidService {

    private static final Logger log = LoggerFactory.getLogger(LanguoidService.class);

    private final LanguoidRepository languoidRepository;
    private final ClassificationRepository classificationRepository;

    public LanguoidService(LanguoidRepository languoidRepository, ClassificationRepository classificationRepository) {
        this.languoidRepository = languoidRepository;
        this.classificationRepository = classificationRepository;
    }

    // ========== ANCESTORS ==========

    /**
     * Ancestors nearest first: father, grandfather, ..., top-level family.
     */
    public List<Languoid> ancestors(Languoid languoid) {
        return languoidRepository.findAncestors(languoid.pk());
    }

    /**
     * Ancestors top-level family first, excluding the languoid itself.
     */
    public List<Languoid> classificationPath(Languoid languoid) {
        List<Languoid> path = new ArrayList<>(ancestors(languoid));
        Collections.reverse(path);
        return path;
    }

    /**
     * Slash separated ids from the top-level family down to the languoid, e.g. "indo1319/germ1287/stan1295".
     */
    public String treePath(Languoid languoid) {
        List<String> ids = classificationPath(languoid).stream()
            .map(Languoid::id)
            .collect(Collectors.toCollection(ArrayList::new));
        ids.add(languoid.id());
        return String.join("/", ids);
    }

    // ========== CLASSIFICATION ==========

    public Optional<Classification> classification(Languoid languoid, ClassificationKind kind) {
        return classificationRepository.find(languoid.pk(), kind)
            .filter(Classification::hasDescription);
    }

    /**
     * The languoid's own sub-classification references, or those of the nearest ancestor
     * that has some. Empty when no languoid up to the top-level family has any.
     */
    public List<CitedReference> subclassificationRefs(Languoid languoid) {
        Set<Long> visited = new HashSet<>();
        Languoid current = languoid;
        while (current != null && visited.add(current.pk())) {
            List<CitedReference> refs = classificationRepository.findReferences(current.pk(), ClassificationKind.SUB);
            if (!refs.isEmpty()) {
                return refs;
            }
            if (current.fatherPk() == null) {
                break;
            }
            current = languoidRepository.findByPk(current.fatherPk()).orElse(null);
        }
        if (current != null && current.fatherPk() != null) {
            log.warn("Cycle in father links at languoid {}", current.id());
        }
        return List.of();
    }

    /**
     * Family classification references followed by the (possibly inherited) sub-classification
     * references, newest first. References without a year sort as year 0; ties keep their order.
     */
    public List<CitedReference> combinedRefs(Languoid languoid) {
        List<CitedReference> refs = new ArrayList<>(
            classificationRepository.findReferences(languoid.pk(), ClassificationKind.FAMILY));
        refs.addAll(subclassificationRefs(languoid));
        refs.sort(Comparator.comparingInt(CitedReference::sortYear).reversed());
        return refs;
    }

    // ========== TREE ==========

    /**
     * Nested nodes of the whole family the languoid belongs to, top-level nodes first.
     * Nodes whose father was not reached by the closure walk are left out.
     */
    public List<TreeNode> tree(Languoid languoid) {
        Set<Long> childrenOfSelf = languoidRepository.findChildren(languoid.pk()).stream()
            .map(Languoid::pk)
            .collect(Collectors.toSet());

        List<TreeNode> roots = new ArrayList<>();
        Map<Long, TreeNode> nodes = new HashMap<>();
        int dropped = 0;

        for (TreeRow row : languoidRepository.findSubtreeRows(languoid.rootPk())) {
            TreeNode node = new TreeNode(row.id(), row.pk(), isoCode(row.hid()), row.level(),
                label(row.name(), row.childLanguageCount()));
            if (childrenOfSelf.contains(row.pk())) {
                node.setChild(true);
            }

            if (row.fatherPk() == null) {
                roots.add(node);
            } else {
                TreeNode father = nodes.get(row.fatherPk());
                if (father == null) {
                    // e.g. dialects attached to inactive nodes
                    dropped++;
                    continue;
                }
                father.getChildren().add(node);
            }
            nodes.put(row.pk(), node);
        }

        if (dropped > 0) {
            log.debug("Dropped {} orphan nodes from tree of {}", dropped, languoid.id());
        }
        return roots;
    }

    private static String label(String name, Integer childLanguageCount) {
        if (childLanguageCount == null || childLanguageCount == 0) {
            return name;
        }
        return name + " (" + childLanguageCount + ")";
    }

    private static String isoCode(String hid) {
        return hid != null && hid.length() == 3 ? hid : null;
    }

    // ========== CONSISTENCY ==========

    /**
     * Languoids whose family pointer disagrees with the deepest ancestor in the closure table.
     */
    public List<Languoid> findInconsistentFamilyPointers() {
        Map<Long, Long> deepest = languoidRepository.findDeepestAncestors();
        List<Languoid> inconsistent = new ArrayList<>();
        for (Languoid languoid : languoidRepository.findAll()) {
            Long expected = deepest.get(languoid.pk());
            if (!Objects.equals(expected, languoid.familyPk())) {
                inconsistent.add(languoid);
            }
        }
        if (!inconsistent.isEmpty()) {
            log.warn("{} languoids with inconsistent family pointer", inconsistent.size());
        }
        return inconsistent;
    }

    public static class TreeNode {
        private final String id;
        private final Long pk;
        private final String iso;
        private final LanguoidLevel level;
        private final String label;
        private boolean child;
        private List<TreeNode> children = new ArrayList<>();

        public TreeNode(String id, Long pk, String iso, LanguoidLevel level, String label) {
            this.id = id;
            this.pk = pk;
            this.iso = iso;
            this.level = level;
            this.label = label;
        }

        // Getters
        public String getId() { return id; }
        public Long getPk() { return pk; }
        public String getIso() { return iso; }
        public LanguoidLevel getLevel() { return level; }
        public String getLabel() { return label; }
        public boolean isChild() { return child; }
        public List<TreeNode> getChildren() { return children; }

        // Setters
        public void setChild(boolean child) { this.child = child; }
        public void setChildren(List<TreeNode> children) { this.children = children; }
    }
}

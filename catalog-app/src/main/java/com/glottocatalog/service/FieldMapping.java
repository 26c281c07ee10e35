package com.glottocatalog.service;

import com.glottocatalog.model.ReferenceField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Static table routing source field names to canonical {@link ReferenceField}s.
 * Source fields mapped to nothing are kept verbatim in the side-bag of a reference.
 */
public final class FieldMapping {

    private final Map<String, Optional<ReferenceField>> targets;
    private final Map<ReferenceField, Function<String, Object>> converters;

    private FieldMapping(Map<String, Optional<ReferenceField>> targets,
                         Map<ReferenceField, Function<String, Object>> converters) {
        this.targets = Collections.unmodifiableMap(targets);
        this.converters = Collections.unmodifiableMap(converters);
    }

    public boolean isKnown(String sourceKey) {
        return targets.containsKey(sourceKey);
    }

    /**
     * @return the canonical field for the source key, empty when unmapped or unknown
     */
    public Optional<ReferenceField> target(String sourceKey) {
        return targets.getOrDefault(sourceKey, Optional.empty());
    }

    /**
     * Converts a raw value for the given field.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public Object convert(ReferenceField field, String value) {
        Function<String, Object> converter = converters.get(field);
        if (converter != null) {
            return converter.apply(value);
        }
        if (field.type() != String.class) {
            throw new IllegalArgumentException("No converter registered for " + field.key());
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The mapping used for the Glottolog bibliography, including the misspelt keys that
     * occur in provider files.
     */
    public static FieldMapping glottolog() {
        return builder()
            .map("address", ReferenceField.ADDRESS)
            .map("adress", ReferenceField.ADDRESS)
            .map("author", ReferenceField.AUTHOR)
            .map("booktitle", ReferenceField.BOOKTITLE)
            .map("edition", ReferenceField.EDITION)
            .map("editor", ReferenceField.EDITOR)
            .map("inlg", ReferenceField.INLG)
            .map("journal", ReferenceField.JOURNAL)
            .map("note", ReferenceField.NOTE)
            .map("notes", ReferenceField.NOTE)
            .map("number", ReferenceField.NUMBER)
            .map("numner", ReferenceField.NUMBER)
            .map("oages", ReferenceField.PAGES)
            .map("ozbib_id", ReferenceField.OZBIB_ID)
            .map("paged", ReferenceField.PAGES)
            .map("pages", ReferenceField.PAGES)
            .map("pagex", ReferenceField.PAGES)
            .map("pgaes", ReferenceField.PAGES)
            .map("publisher", ReferenceField.PUBLISHER)
            .map("school", ReferenceField.SCHOOL)
            .map("series", ReferenceField.SERIES)
            .map("subject", ReferenceField.SUBJECT)
            .map("subject_headings", ReferenceField.SUBJECT_HEADINGS)
            .map("title", ReferenceField.TITLE)
            .map("url", ReferenceField.URL)
            .map("volume", ReferenceField.VOLUME)
            .map("volumr", ReferenceField.VOLUME)
            .map("year", ReferenceField.YEAR)
            .unmapped(
                "abstract", "added", "additional_items", "adviser", "aiatsis_callnumber",
                "aiatsis_code", "aiatsis_reference_language", "alnumcodes", "anlanote",
                "anlclanguage", "anlctype", "annote", "asjp_name", "audiofile", "author_note",
                "author_statement", "booktitle_english", "bwonote", "call_number", "citation",
                "class_loc", "collection", "comments", "contains_also", "contributed", "copies",
                "copyright", "country", "coverage", "crossref", "de", "degree", "digital_formats",
                "document_type", "doi", "domain", "edition_note", "english_title", "extra_hash",
                "extrahash", "file", "fn", "fnnote", "folder", "format", "german_subject_headings",
                "glottolog_ref_id", "guldemann_location", "hhnote", "hhtype", "howpublished", "id",
                "institution", "isbn", "issn", "issue", "jfmnote", "key", "keywords", "langcode",
                "langnote", "languoidbase_ids", "lapollanote", "last_changed", "lccn", "lcode",
                "lgcde", "lgcode", "lgcoe", "lgcosw", "lgfamily", "macro_area", "modified", "month",
                "mpi_eva_library_shelf", "mpifn", "no_inventaris", "numberofpages", "oldhhfn",
                "oldhhfnnote", "omnote", "other_editions", "otomanguean_heading", "owner",
                "ozbibnote", "ozbibreftype", "permission", "phdthesis", "prepages", "pubnote",
                "rating", "read", "relatedresource", "replication", "reprint", "restrictions",
                "review", "seanote", "seifarttype", "series_english", "shelf_location",
                "shorttitle", "sil_id", "source", "src", "srctrickle", "stampeann", "stampedesc",
                "status", "subsistence_note", "superseded", "thanks", "thesistype", "timestamp",
                "title_english", "titlealt", "typ", "umi_id", "vernacular_title", "weball_lgs",
                "yeartitle")
            .converter(ReferenceField.OZBIB_ID, value -> Integer.valueOf(value.strip()))
            .build();
    }

    public static class Builder {

        private final Map<String, Optional<ReferenceField>> targets = new LinkedHashMap<>();
        private final Map<ReferenceField, Function<String, Object>> converters = new LinkedHashMap<>();

        public Builder map(String sourceKey, ReferenceField target) {
            put(sourceKey, Optional.of(target));
            return this;
        }

        public Builder unmapped(String... sourceKeys) {
            for (String key : sourceKeys) {
                put(key, Optional.empty());
            }
            return this;
        }

        public Builder converter(ReferenceField field, Function<String, Object> converter) {
            converters.put(field, converter);
            return this;
        }

        private void put(String sourceKey, Optional<ReferenceField> target) {
            if (sourceKey == null || sourceKey.isBlank()) {
                throw new IllegalStateException("Blank source key in field mapping");
            }
            if (!sourceKey.equals(sourceKey.toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Source key must be lower case: " + sourceKey);
            }
            if (targets.containsKey(sourceKey)) {
                throw new IllegalStateException("Duplicate source key in field mapping: " + sourceKey);
            }
            targets.put(sourceKey, target);
        }

        public FieldMapping build() {
            for (Map.Entry<String, Optional<ReferenceField>> entry : targets.entrySet()) {
                ReferenceField field = entry.getValue().orElse(null);
                if (field != null && field.type() != String.class && !converters.containsKey(field)) {
                    throw new IllegalStateException(
                        "Source key " + entry.getKey() + " maps to " + field.key() + " which needs a converter");
                }
            }
            return new FieldMapping(new LinkedHashMap<>(targets), new LinkedHashMap<>(converters));
        }
    }
}

package com.glottocatalog.service;

import com.glottocatalog.bibtex.BibtexText;
import com.glottocatalog.model.BibRecord;
import com.glottocatalog.model.ReferenceField;
import com.glottocatalog.util.FieldNormalizer;
import com.glottocatalog.util.PageCounts;
import com.glottocatalog.util.PublisherAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw bibliography records onto the canonical reference schema and derives the
 * numeric year and page facts.
 */
public class RecordParser {

    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    public static final String ID_FIELD = "glottolog_ref_id";
    public static final String BIBTEXKEY = "bibtexkey";
    public static final String NUMBER_OF_PAGES_FIELD = "numberofpages";
    public static final String LGCODE_FIELD = "lgcode";

    private final FieldMapping fieldMapping;
    private final int minimumFields;

    public RecordParser(FieldMapping fieldMapping, int minimumFields) {
        this.fieldMapping = fieldMapping;
        this.minimumFields = minimumFields;
    }

    /**
     * @return the parsed record, or empty if the record has too few populated fields to be useful
     * @throws MissingReferenceIdException if the record has no integer {@value #ID_FIELD}
     */
    public Optional<ParsedRecord> parse(BibRecord record) {
        if (record.populatedFieldCount() < minimumFields) {
            return Optional.empty();
        }
        long pk = requireId(record);

        Map<ReferenceField, Object> values = new EnumMap<>(ReferenceField.class);
        Map<String, String> sideBag = new LinkedHashMap<>();
        sideBag.put(BIBTEXKEY, record.key());
        if (record.type() != null) {
            values.put(ReferenceField.BIBTEX_TYPE, record.type());
        }

        for (Map.Entry<String, String> field : record.fields().entrySet()) {
            String name = field.getKey();
            if (field.getValue() == null || field.getValue().isBlank()) {
                continue;
            }
            String value = BibtexText.unescape(field.getValue());
            if (value.isEmpty()) {
                continue;
            }
            Optional<ReferenceField> target = fieldMapping.target(name);
            if (target.isPresent()) {
                putCanonical(pk, values, target.get(), name, value);
            } else {
                if (!fieldMapping.isKnown(name)) {
                    log.debug("Unknown field '{}' in record {} kept in side-bag", name, pk);
                }
                sideBag.put(name, value);
            }
        }

        String lgcode = sideBag.get(LGCODE_FIELD);
        if (lgcode != null && lgcode.length() == 3) {
            sideBag.put(LGCODE_FIELD, "[" + lgcode + "]");
        }

        deriveFacts(values, sideBag);
        return Optional.of(new ParsedRecord(pk, values, sideBag));
    }

    private long requireId(BibRecord record) {
        String raw = record.get(ID_FIELD);
        if (raw == null || raw.isBlank()) {
            throw new MissingReferenceIdException(record.key(), "Record " + record.key() + " has no " + ID_FIELD);
        }
        try {
            return Long.parseLong(raw.strip());
        } catch (NumberFormatException e) {
            throw new MissingReferenceIdException(record.key(),
                "Record " + record.key() + " has a non-numeric " + ID_FIELD + ": " + raw);
        }
    }

    private void putCanonical(long pk, Map<ReferenceField, Object> values, ReferenceField target,
                              String sourceKey, String value) {
        if (values.containsKey(target)) {
            log.debug("Record {}: '{}' ignored, {} already set", pk, sourceKey, target.key());
            return;
        }
        try {
            values.put(target, fieldMapping.convert(target, value));
        } catch (IllegalArgumentException e) {
            log.debug("Record {}: malformed {} '{}'", pk, sourceKey, value);
        }
    }

    private static void deriveFacts(Map<ReferenceField, Object> values, Map<String, String> sideBag) {
        Integer year = FieldNormalizer.extractYear((String) values.get(ReferenceField.YEAR));
        if (year != null) {
            values.put(ReferenceField.YEAR_INT, year);
        }

        String publisher = (String) values.get(ReferenceField.PUBLISHER);
        if (publisher != null) {
            PublisherAddress split = FieldNormalizer.splitPublisherAddress(
                publisher, (String) values.get(ReferenceField.ADDRESS));
            if (split.address() != null) {
                values.put(ReferenceField.ADDRESS, split.address());
            }
            values.put(ReferenceField.PUBLISHER, split.publisher());
        }

        PageCounts pages = FieldNormalizer.parsePages(
            (String) values.get(ReferenceField.PAGES), sideBag.get(NUMBER_OF_PAGES_FIELD));
        if (pages.start() != null) {
            values.put(ReferenceField.STARTPAGE_INT, pages.start());
        }
        if (pages.end() != null) {
            values.put(ReferenceField.ENDPAGE_INT, pages.end());
        }
        if (pages.total() != null) {
            values.put(ReferenceField.PAGES_INT, pages.total());
        }
    }
}

package com.glottocatalog.service;

import com.glottocatalog.model.BibRecord;
import com.glottocatalog.model.ReferenceField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordParserTest {

    private final RecordParser parser = new RecordParser(FieldMapping.glottolog(), 6);

    private static BibRecord record(String... keyValues) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(keyValues[i], keyValues[i + 1]);
        }
        return new BibRecord("book", "hh:s:Heine:Survey", fields);
    }

    private ParsedRecord parse(BibRecord record) {
        return parser.parse(record).orElseThrow();
    }

    @Nested
    @DisplayName("canonical fields")
    class CanonicalFields {

        private final BibRecord full = record(
                "glottolog_ref_id", "5001",
                "author", "Hammarstr{\\\"o}m, Harald",
                "year", "[1987] 1990",
                "title", "A {G}rammar of {D}yirbal",
                "publisher", "Berlin: Mouton",
                "pages", "xii+234",
                "src", "hh",
                "favourite_colour", "blue");

        @Test
        void usesIdentifierAsKey() {
            assertThat(parse(full).pk()).isEqualTo(5001L);
        }

        @Test
        void unescapesValues() {
            ParsedRecord parsed = parse(full);

            assertThat(parsed.get(ReferenceField.AUTHOR)).isEqualTo("Hammarström, Harald");
            assertThat(parsed.get(ReferenceField.TITLE)).isEqualTo("A Grammar of Dyirbal");
        }

        @Test
        void keepsEntryTypeAsBibtexType() {
            assertThat(parse(full).values()).containsEntry(ReferenceField.BIBTEX_TYPE, "book");
        }

        @Test
        void derivesYearAndPageNumbers() {
            ParsedRecord parsed = parse(full);

            assertThat(parsed.values())
                    .containsEntry(ReferenceField.YEAR, "[1987] 1990")
                    .containsEntry(ReferenceField.YEAR_INT, 1987)
                    .containsEntry(ReferenceField.PAGES_INT, 246)
                    .doesNotContainKeys(ReferenceField.STARTPAGE_INT, ReferenceField.ENDPAGE_INT);
        }

        @Test
        void splitsPublisherIntoAddress() {
            ParsedRecord parsed = parse(full);

            assertThat(parsed.get(ReferenceField.ADDRESS)).isEqualTo("Berlin");
            assertThat(parsed.get(ReferenceField.PUBLISHER)).isEqualTo("Mouton");
        }

        @Test
        void keepsRecordAddress() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000",
                    "address", "Leipzig", "publisher", "Berlin: Mouton"));

            assertThat(parsed.get(ReferenceField.ADDRESS)).isEqualTo("Leipzig");
            assertThat(parsed.get(ReferenceField.PUBLISHER)).isEqualTo("Mouton");
        }

        @Test
        void explicitPageCountOverridesTotal() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000",
                    "pages", "12-34", "numberofpages", "300"));

            assertThat(parsed.values())
                    .containsEntry(ReferenceField.STARTPAGE_INT, 12)
                    .containsEntry(ReferenceField.ENDPAGE_INT, 34)
                    .containsEntry(ReferenceField.PAGES_INT, 300);
            assertThat(parsed.sideBagValue("numberofpages")).isEqualTo("300");
        }

        @Test
        void keepsPagesWhenCountDoesNotFitAnInt() {
            BibRecord oversized = record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000",
                    "pages", "12345678901+iv", "note", "misprint");

            assertThatCode(() -> parser.parse(oversized)).doesNotThrowAnyException();

            ParsedRecord parsed = parse(oversized);
            assertThat(parsed.get(ReferenceField.PAGES)).isEqualTo("12345678901+iv");
            assertThat(parsed.values()).doesNotContainKeys(
                    ReferenceField.PAGES_INT, ReferenceField.STARTPAGE_INT, ReferenceField.ENDPAGE_INT);
        }

        @Test
        void firstValueForATargetWins() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000",
                    "note", "first", "notes", "second"));

            assertThat(parsed.get(ReferenceField.NOTE)).isEqualTo("first");
        }

        @Test
        void dropsMalformedConvertedValues() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "no year",
                    "ozbib_id", "x17", "journal", "Oceania"));

            assertThat(parsed.values()).doesNotContainKeys(ReferenceField.OZBIB_ID, ReferenceField.YEAR_INT);
            assertThat(parsed.get(ReferenceField.JOURNAL)).isEqualTo("Oceania");
        }
    }

    @Nested
    @DisplayName("side-bag")
    class SideBag {

        @Test
        void keepsUnmappedAndUnknownFields() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t",
                    "src", "hh, ozbib", "hhtype", "grammar", "favourite_colour", "blue"));

            assertThat(parsed.sideBag())
                    .containsEntry("bibtexkey", "hh:s:Heine:Survey")
                    .containsEntry("glottolog_ref_id", "1")
                    .containsEntry("src", "hh, ozbib")
                    .containsEntry("hhtype", "grammar")
                    .containsEntry("favourite_colour", "blue");
        }

        @Test
        void bracketsThreeLetterLanguageCodes() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000", "note", "n",
                    "lgcode", "deu"));

            assertThat(parsed.sideBagValue("lgcode")).isEqualTo("[deu]");
        }

        @Test
        void leavesLongerLanguageCodesAlone() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000", "note", "n",
                    "lgcode", "German [deu]"));

            assertThat(parsed.sideBagValue("lgcode")).isEqualTo("German [deu]");
        }

        @Test
        void missingSideBagValueIsEmpty() {
            ParsedRecord parsed = parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000", "note", "n",
                    "series", "s"));

            assertThat(parsed.sideBagValue("macro_area")).isEmpty();
        }
    }

    @Nested
    @DisplayName("rejected records")
    class Rejected {

        @Test
        void skipsSparseRecords() {
            Optional<ParsedRecord> parsed = parser.parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000", "note", "n"));

            assertThat(parsed).isEmpty();
        }

        @Test
        void blankFieldsDoNotCount() {
            Optional<ParsedRecord> parsed = parser.parse(record(
                    "glottolog_ref_id", "1", "author", "a", "title", "t", "year", "2000", "note", "n",
                    "series", "  "));

            assertThat(parsed).isEmpty();
        }

        @Test
        void failsWithoutIdentifier() {
            BibRecord record = record("author", "a", "title", "t", "year", "2000", "note", "n",
                    "series", "s", "volume", "1");

            assertThatThrownBy(() -> parser.parse(record))
                    .isInstanceOf(MissingReferenceIdException.class)
                    .hasMessageContaining("hh:s:Heine:Survey")
                    .extracting("bibtexKey").isEqualTo("hh:s:Heine:Survey");
        }

        @Test
        void failsForNonNumericIdentifier() {
            BibRecord record = record("glottolog_ref_id", "abc", "author", "a", "title", "t",
                    "year", "2000", "note", "n", "series", "s");

            assertThatThrownBy(() -> parser.parse(record))
                    .isInstanceOf(MissingReferenceIdException.class)
                    .hasMessageContaining("abc");
        }
    }
}

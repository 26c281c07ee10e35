package com.glottocatalog.service;

import com.glottocatalog.bibtex.BibtexCorpusReader;
import com.glottocatalog.model.BibRecord;
import com.glottocatalog.model.Doctype;
import com.glottocatalog.model.Languoid;
import com.glottocatalog.model.MacroArea;
import com.glottocatalog.model.Provider;
import com.glottocatalog.model.Reference;
import com.glottocatalog.repository.ReferenceRepository;
import com.glottocatalog.repository.VocabularyRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@Sql({"/catalog-vocabulary.sql", "/catalog-references.sql", "/languoid-tree.sql"})
@Transactional
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
class ReferenceImportServiceTest {

    @Autowired
    private ReferenceImportService importService;

    @SpyBean
    private ReferenceRepository referenceRepository;

    @Autowired
    private VocabularyRepository vocabularyRepository;

    // Reference 5001 from catalog-references.sql: 2010, providers hh and ozbib, doctype overview
    private static final Long HEINE = 5001L;
    private static final Long DIXON = 6001L;

    private static final String HEINE_REVISED = """
        @book{hh:s:Heine:Survey,
          glottolog_ref_id = {5001},
          author = {Heine, Bernd},
          year = {2011},
          title = {A survey of African languages},
          publisher = {Berlin: Mouton},
          src = {ozbib, ldh},
          macro_area = {Africa},
          hhtype = {overview; grammar_sketch}
        }
        """;

    private static final String DIXON_NEW = """
        @article{ozbib:1,
          glottolog_ref_id = {6001},
          author = {Dixon, R. M. W.},
          year = {[1980] 1982},
          title = {The languages of {A}ustralia},
          journal = {Oceania},
          pages = {xii+34},
          ozbib_id = {42},
          src = {ozbib},
          macro_area = {Australia},
          hhtype = {grammar_sketch (partial); dictionary},
          lgcode = {deu}
        }
        """;

    private static final String SPARSE = """
        @misc{sparse, glottolog_ref_id = {7001}, author = {X}, title = {Y}, year = {2000}, note = {n}}
        """;

    private static final String UNRESOLVABLE = """
        @misc{hh:unknown,
          glottolog_ref_id = {7002},
          author = {Nobody},
          title = {Nowhere},
          year = {2001},
          src = {weball},
          macro_area = {Atlantis},
          hhtype = {nonsense_type},
          lgcode = {[xxx]}
        }
        """;

    private static final String WITHOUT_ID = """
        @misc{hh:noid, author = {A}, title = {B}, year = {2001}, note = {n}, series = {s}, volume = {1}}
        """;

    private static List<BibRecord> records(String... entries) {
        return BibtexCorpusReader.parse(String.join("\n", entries));
    }

    private Reference load(Long pk) {
        return referenceRepository.findByPk(pk).orElseThrow();
    }

    // ========== CREATE ==========

    @Nested
    @DisplayName("new references")
    class NewReferences {

        @Test
        void createsReferenceWithParsedFields() {
            ImportSummary summary = importService.run(records(DIXON_NEW), ImportMode.INSERT);

            assertThat(summary.getCreated()).isEqualTo(1);
            assertThat(summary.getChanged()).isEqualTo(1);

            Reference dixon = load(DIXON);
            assertThat(dixon.getId()).isEqualTo("6001");
            assertThat(dixon.getBibtexType()).isEqualTo("article");
            assertThat(dixon.getName()).isEqualTo("Dixon, R. M. W. [1980] 1982");
            assertThat(dixon.getTitle()).isEqualTo("The languages of Australia");
            assertThat(dixon.getDescription()).isEqualTo("The languages of Australia");
            assertThat(dixon.getYearInt()).isEqualTo(1980);
            assertThat(dixon.getPagesInt()).isEqualTo(46);
            assertThat(dixon.getOzbibId()).isEqualTo(42);
            assertThat(dixon.getJsondata())
                    .containsEntry("bibtexkey", "ozbib:1")
                    .containsEntry("lgcode", "[deu]");
        }

        @Test
        void linksVocabulariesAndLanguoids() {
            importService.run(records(DIXON_NEW), ImportMode.INSERT);

            Reference dixon = load(DIXON);
            assertThat(dixon.getProviders()).extracting(Provider::id).containsExactly("ozbib");
            assertThat(dixon.getMacroareas()).extracting(MacroArea::id).containsExactly("australia");
            assertThat(dixon.getDoctypes()).extracting(Doctype::id).containsExactly("grammar_sketch", "dictionary");
            assertThat(dixon.getLanguoids()).extracting(Languoid::id).containsExactly("stan1295");
        }

        @Test
        void storesSummaryStrings() {
            importService.run(records(DIXON_NEW), ImportMode.INSERT);

            Reference dixon = load(DIXON);
            assertThat(dixon.getDoctypesStr()).isEqualTo("grammar_sketch, dictionary");
            assertThat(dixon.getProvidersStr()).isEqualTo("ozbib");
        }

        @Test
        void namesReferencesWithoutAuthorOrYear() {
            String anonymous = """
                @misc{anon, glottolog_ref_id = {7003}, title = {T}, note = {n}, series = {s}, volume = {1}, src = {hh}}
                """;

            importService.run(records(anonymous), ImportMode.INSERT);

            assertThat(load(7003L).getName()).isEqualTo("na nd");
        }

        @Test
        void createdReferencesAreNotInTheChangeLog() {
            ImportSummary summary = importService.run(records(DIXON_NEW), ImportMode.INSERT);

            assertThat(summary.getChangeLog().isEmpty()).isTrue();
        }
    }

    // ========== UPDATE ==========

    @Nested
    @DisplayName("known references")
    class KnownReferences {

        @Test
        void insertModeSkipsKnownReferences() {
            ImportSummary summary = importService.run(records(HEINE_REVISED), ImportMode.INSERT);

            assertThat(summary.getSkippedKnown()).isEqualTo(1);
            assertThat(summary.getChanged()).isZero();
            assertThat(load(HEINE).getYear()).isEqualTo("2010");
            assertThat(load(HEINE).getProviders()).extracting(Provider::id).containsExactly("hh", "ozbib");
        }

        @Test
        void updateModeAppliesDifferingFields() {
            ImportSummary summary = importService.run(records(HEINE_REVISED), ImportMode.UPDATE);

            assertThat(summary.getChanged()).isEqualTo(1);
            assertThat(summary.getCreated()).isZero();

            Reference heine = load(HEINE);
            assertThat(heine.getYear()).isEqualTo("2011");
            assertThat(heine.getYearInt()).isEqualTo(2011);
            assertThat(heine.getAddress()).isEqualTo("Berlin");
            assertThat(heine.getPublisher()).isEqualTo("Mouton");
        }

        @Test
        void recordsOldAndNewValues() {
            ImportSummary summary = importService.run(records(HEINE_REVISED), ImportMode.UPDATE);

            assertThat(summary.getChangeLog().changesFor("5001"))
                    .containsOnlyKeys("year", "year_int")
                    .containsEntry("year", List.of("2010", "2011"))
                    .containsEntry("year_int", List.of("2010", "2011"));
        }

        @Test
        void providersOnlyAccumulate() {
            importService.run(records(HEINE_REVISED), ImportMode.UPDATE);

            Reference heine = load(HEINE);
            assertThat(heine.getProviders()).extracting(Provider::id).containsExactly("hh", "ldh", "ozbib");
            assertThat(heine.getProvidersStr()).isEqualTo("hh, ldh, ozbib");
        }

        @Test
        void doctypeSummaryFollowsDoctypeOrder() {
            importService.run(records(HEINE_REVISED), ImportMode.UPDATE);

            Reference heine = load(HEINE);
            assertThat(heine.getDoctypes()).extracting(Doctype::id).containsExactly("grammar_sketch", "overview");
            assertThat(heine.getDoctypesStr()).isEqualTo("grammar_sketch, overview");
        }

        @Test
        void mergesSideBag() {
            importService.run(records(HEINE_REVISED), ImportMode.UPDATE);

            assertThat(load(HEINE).getJsondata())
                    .containsEntry("bibtexkey", "hh:s:Heine:Survey")
                    .containsEntry("src", "ozbib, ldh")
                    .containsEntry("hhtype", "overview; grammar_sketch");
        }

        @Test
        void linkAdditionsAloneMarkReferenceChanged() {
            String sameFieldsNewProvider = HEINE_REVISED.replace("{2011}", "{2010}");

            ImportSummary summary = importService.run(records(sameFieldsNewProvider), ImportMode.UPDATE);

            assertThat(summary.getChanged()).isEqualTo(1);
            assertThat(summary.getChangeLog().isEmpty()).isTrue();
        }
    }

    // ========== IDEMPOTENCE ==========

    @Nested
    @DisplayName("repeated runs")
    class RepeatedRuns {

        @Test
        void secondRunChangesNothing() {
            List<BibRecord> corpus = records(HEINE_REVISED, DIXON_NEW);
            importService.run(corpus, ImportMode.UPDATE);
            clearInvocations(referenceRepository);

            ImportSummary second = importService.run(corpus, ImportMode.UPDATE);

            assertThat(second.getChanged()).isZero();
            assertThat(second.getCreated()).isZero();
            assertThat(second.getChangeLog().isEmpty()).isTrue();
            verify(referenceRepository, never()).updateField(any(), any(), any());
            verify(referenceRepository, never()).updateSummaries(any(), any(), any());
            verify(referenceRepository, never()).insert(any());
        }

        @Test
        void insertThenUpdateChangesNothing() {
            importService.run(records(DIXON_NEW), ImportMode.INSERT);

            ImportSummary second = importService.run(records(DIXON_NEW), ImportMode.UPDATE);

            assertThat(second.getChanged()).isZero();
        }
    }

    // ========== SKIPS AND FAILURES ==========

    @Nested
    @DisplayName("skipped and unresolved input")
    class SkippedInput {

        @Test
        void sparseRecordsAreCountedAndNeverWritten() {
            ImportSummary summary = importService.run(records(SPARSE, DIXON_NEW), ImportMode.UPDATE);

            assertThat(summary.getProcessed()).isEqualTo(2);
            assertThat(summary.getSkippedSparse()).isEqualTo(1);
            assertThat(referenceRepository.findByPk(7001L)).isEmpty();
        }

        @Test
        void unresolvedTagsAreCountedPerKind() {
            ImportSummary summary = importService.run(records(UNRESOLVABLE), ImportMode.INSERT);

            assertThat(summary.getCreated()).isEqualTo(1);
            assertThat(summary.unresolvedCount("provider")).isEqualTo(1);
            assertThat(summary.unresolvedCount("macroarea")).isEqualTo(1);
            assertThat(summary.unresolvedCount("doctype")).isEqualTo(1);
            assertThat(summary.unresolvedCount("languoid")).isEqualTo(1);
            assertThat(summary.getUnresolved().get("provider")).containsEntry("weball", 1);
        }

        @Test
        void recordWithUnresolvedTagsStillCommits() {
            importService.run(records(UNRESOLVABLE), ImportMode.INSERT);

            Reference reference = load(7002L);
            assertThat(reference.getProviders()).isEmpty();
            assertThat(reference.getProvidersStr()).isEmpty();
            assertThat(reference.getTitle()).isEqualTo("Nowhere");
        }

        @Test
        void missingIdentifierAbortsRun() {
            assertThatThrownBy(() -> importService.run(records(DIXON_NEW, WITHOUT_ID), ImportMode.INSERT))
                    .isInstanceOf(MissingReferenceIdException.class)
                    .hasMessageContaining("hh:noid")
                    .extracting("bibtexKey").isEqualTo("hh:noid");
        }
    }

    // ========== PROVIDERS ==========

    @Test
    void synchronizesConfiguredProviders() {
        importService.run(List.of(), ImportMode.INSERT);

        assertThat(vocabularyRepository.findProvider("hh")).get()
                .extracting(Provider::name).isEqualTo("Hammarström");
        assertThat(vocabularyRepository.findProvider("ldh")).isPresent();
    }
}

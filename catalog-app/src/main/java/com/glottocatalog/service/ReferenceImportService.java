package com.glottocatalog.service;

import com.glottocatalog.config.CatalogProperties;
import com.glottocatalog.model.BibRecord;
import com.glottocatalog.model.Doctype;
import com.glottocatalog.model.Languoid;
import com.glottocatalog.model.MacroArea;
import com.glottocatalog.model.Provider;
import com.glottocatalog.model.Reference;
import com.glottocatalog.model.ReferenceField;
import com.glottocatalog.repository.LanguoidRepository;
import com.glottocatalog.repository.ReferenceRepository;
import com.glottocatalog.repository.VocabularyRepository;
import com.glottocatalog.service.RelationshipReconciler.Reconciliation;
import com.glottocatalog.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reconciles bibliography records with the canonical reference catalog.
 *
 * <p>Each record is parsed, looked up by its permanent key, then either created or diffed
 * field by field against the stored reference. Links to macro-areas, providers, doctypes
 * and (optionally) languoids only ever accumulate. A run is one transaction: any unhandled
 * exception rolls back every record of the run.
 */
@Service
public class ReferenceImportService {

    private static final Logger log = LoggerFactory.getLogger(ReferenceImportService.class);

    // grammar_sketch (comment); dictionary
    static final Pattern DOCTYPE_PATTERN = Pattern.compile("(?<name>[a-z_]+)\\s*(\\((?<comment>[^)]+)\\))?\\s*(;|$)");
    // [deu] or [deu,nld]
    static final Pattern CODE_PATTERN = Pattern.compile("\\[(?<code>[^]]+)]");

    static final String MACROAREA = "macroarea";
    static final String PROVIDER = "provider";
    static final String DOCTYPE = "doctype";
    static final String LANGUOID = "languoid";

    private final ReferenceRepository referenceRepository;
    private final VocabularyRepository vocabularyRepository;
    private final LanguoidRepository languoidRepository;
    private final RecordParser recordParser;
    private final CatalogProperties properties;

    public ReferenceImportService(ReferenceRepository referenceRepository,
                                  VocabularyRepository vocabularyRepository,
                                  LanguoidRepository languoidRepository,
                                  RecordParser recordParser,
                                  CatalogProperties properties) {
        this.referenceRepository = referenceRepository;
        this.vocabularyRepository = vocabularyRepository;
        this.languoidRepository = languoidRepository;
        this.recordParser = recordParser;
        this.properties = properties;
    }

    /**
     * Imports the records in one transaction.
     *
     * @param records source records in corpus order
     * @param mode    whether references with known keys are skipped or updated
     * @return counters and the change log of the run
     * @throws MissingReferenceIdException if a record has no permanent identifier
     */
    @Transactional
    public ImportSummary run(Iterable<BibRecord> records, ImportMode mode) {
        synchronizeProviders();
        Lookups lookups = loadLookups();
        Set<Long> knownPks = referenceRepository.findAllPks();
        int interval = Math.max(1, properties.getImport().getProgressInterval());

        log.info("Importing references in {} mode, {} references known", mode, knownPks.size());
        ImportSummary summary = new ImportSummary();
        for (BibRecord record : records) {
            summary.recordProcessed();
            merge(record, mode, lookups, knownPks, summary);
            if (summary.getProcessed() % interval == 0) {
                log.info("{} records done, {} changed", summary.getProcessed(), summary.getChanged());
            }
        }

        log.info("{} records updated or imported", summary.getChanged());
        log.info("{} records skipped because of lack of information", summary.getSkippedSparse());
        if (!summary.getUnresolved().isEmpty()) {
            log.warn("Unresolved tags: {}", summary.getUnresolved());
        }
        return summary;
    }

    // ========== PER RECORD ==========

    private void merge(BibRecord record, ImportMode mode, Lookups lookups, Set<Long> knownPks, ImportSummary summary) {
        Optional<ParsedRecord> parsed = recordParser.parse(record);
        if (parsed.isEmpty()) {
            log.debug("Skipping sparse record {}", record.key());
            summary.recordSkippedSparse();
            return;
        }
        ParsedRecord rec = parsed.get();

        if (mode != ImportMode.UPDATE && knownPks.contains(rec.pk())) {
            summary.recordSkippedKnown();
            return;
        }

        Optional<Reference> existing = knownPks.contains(rec.pk())
            ? referenceRepository.findByPk(rec.pk())
            : Optional.empty();

        Reference reference;
        boolean changed;
        if (existing.isPresent()) {
            reference = existing.get();
            changed = update(reference, rec, summary.getChangeLog());
        } else {
            reference = create(rec);
            knownPks.add(rec.pk());
            summary.recordCreated();
            changed = true;
        }

        changed |= reconcileRelationships(reference, rec, lookups, summary);

        if (changed) {
            summary.recordChanged();
            reference.setDoctypesStr(joinIds(reference.getDoctypes(), DOCTYPE_ORDER, Doctype::id));
            reference.setProvidersStr(joinIds(reference.getProviders(), PROVIDER_ORDER, Provider::id));
            referenceRepository.updateSummaries(reference.getPk(), reference.getDoctypesStr(), reference.getProvidersStr());
        }
    }

    private Reference create(ParsedRecord rec) {
        Reference reference = new Reference(rec.pk());
        rec.values().forEach(reference::set);
        reference.setName(String.format("%s %s",
            Objects.requireNonNullElse(rec.get(ReferenceField.AUTHOR), "na"),
            Objects.requireNonNullElse(rec.get(ReferenceField.YEAR), "nd")));
        reference.setJsondata(new LinkedHashMap<>(rec.sideBag()));
        reference.mirrorTitle();
        referenceRepository.insert(reference);
        log.debug("Created reference {}", reference.getPk());
        return reference;
    }

    /**
     * Applies every differing canonical value and records it in the change log.
     *
     * @return true if at least one canonical field changed
     */
    private boolean update(Reference reference, ParsedRecord rec, ChangeLog changeLog) {
        boolean changed = false;
        for (Map.Entry<ReferenceField, Object> entry : rec.values().entrySet()) {
            ReferenceField field = entry.getKey();
            Object oldValue = reference.get(field);
            Object newValue = entry.getValue();
            if (!Objects.equals(oldValue, newValue)) {
                log.debug("{} {} -- {}", reference.getPk(), field.key(), oldValue);
                log.debug("{} {} ++ {}", reference.getPk(), field.key(), newValue);
                reference.set(field, newValue);
                referenceRepository.updateField(reference.getPk(), field, newValue);
                changeLog.record(reference.getId(), field.key(), oldValue, newValue);
                changed = true;
            }
        }

        Map<String, String> merged = new LinkedHashMap<>(reference.getJsondata());
        merged.putAll(rec.sideBag());
        if (!merged.equals(reference.getJsondata())) {
            reference.setJsondata(merged);
            referenceRepository.updateJsondata(reference.getPk(), merged);
        }

        // re-applied on every pass, also when the title itself is unchanged
        String description = reference.getDescription();
        reference.mirrorTitle();
        if (!Objects.equals(description, reference.getDescription())) {
            referenceRepository.updateDescription(reference.getPk(), reference.getDescription());
        }
        return changed;
    }

    // ========== RELATIONSHIPS ==========

    /**
     * @return true if any link was added
     */
    private boolean reconcileRelationships(Reference reference, ParsedRecord rec, Lookups lookups, ImportSummary summary) {
        Long pk = reference.getPk();
        boolean added = false;

        List<MacroArea> macroAreas = resolve(pk, split(rec.sideBagValue("macro_area"), ","),
            lookups.macroAreasByName()::get, MACROAREA, summary);
        added |= link(reference.getMacroareas(), macroAreas, m -> referenceRepository.addMacroArea(pk, m));

        List<Provider> providers = resolve(pk, split(rec.sideBagValue("src"), ","),
            name -> lookups.providersBySlug().get(Slugs.slug(name)), PROVIDER, summary);
        added |= link(reference.getProviders(), providers, p -> referenceRepository.addProvider(pk, p));

        List<Doctype> doctypes = resolve(pk, doctypeNames(rec.sideBagValue("hhtype")),
            lookups.doctypesByName()::get, DOCTYPE, summary);
        added |= link(reference.getDoctypes(), doctypes, d -> referenceRepository.addDoctype(pk, d));

        if (lookups.languoidsByCode() != null) {
            List<Languoid> languoids = resolve(pk, languoidCodes(rec), lookups.languoidsByCode()::get, LANGUOID, summary);
            added |= link(reference.getLanguoids(), languoids, l -> referenceRepository.addLanguoid(pk, l));
        }
        return added;
    }

    private <T> boolean link(List<T> existing, List<T> desired, Consumer<T> store) {
        Reconciliation<T> reconciliation = RelationshipReconciler.reconcile(existing, desired);
        for (T member : reconciliation.added()) {
            store.accept(member);
            existing.add(member);
        }
        return reconciliation.hasAdditions();
    }

    private <T> List<T> resolve(Long pk, Set<String> names, Function<String, T> lookup, String kind, ImportSummary summary) {
        List<T> resolved = new ArrayList<>();
        for (String name : names) {
            T entity = lookup.apply(name);
            if (entity == null) {
                log.warn("Reference {}: unknown {} '{}'", pk, kind, name);
                summary.recordUnresolved(kind, name);
            } else {
                resolved.add(entity);
            }
        }
        return resolved;
    }

    static Set<String> split(String value, String separator) {
        Set<String> parts = new LinkedHashSet<>();
        for (String part : value.split(Pattern.quote(separator))) {
            if (!part.isBlank()) {
                parts.add(part.strip());
            }
        }
        return parts;
    }

    static Set<String> doctypeNames(String hhtype) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = DOCTYPE_PATTERN.matcher(hhtype);
        while (m.find()) {
            names.add(m.group("name"));
        }
        return names;
    }

    /**
     * ISO codes or hids in brackets from lgcode, glottocodes from alnumcodes.
     */
    static Set<String> languoidCodes(ParsedRecord rec) {
        Set<String> codes = new LinkedHashSet<>();
        Matcher m = CODE_PATTERN.matcher(rec.sideBagValue(RecordParser.LGCODE_FIELD));
        while (m.find()) {
            codes.addAll(split(m.group("code"), ","));
        }
        codes.addAll(split(rec.sideBagValue("alnumcodes"), ";"));
        return codes;
    }

    // ========== SUMMARIES ==========

    private static final Comparator<Doctype> DOCTYPE_ORDER =
        Comparator.comparing(Doctype::ord, Comparator.nullsLast(Comparator.naturalOrder())).thenComparing(Doctype::id);
    private static final Comparator<Provider> PROVIDER_ORDER = Comparator.comparing(Provider::id);

    private static <T> String joinIds(List<T> items, Comparator<T> order, Function<T, String> id) {
        return items.stream().sorted(order).map(id).collect(Collectors.joining(", "));
    }

    // ========== LOOKUPS ==========

    private void synchronizeProviders() {
        int inserted = 0;
        int updated = 0;
        for (CatalogProperties.ProviderDefinition definition : properties.getProviders()) {
            Provider provider = definition.toProvider();
            if (provider.id() == null || provider.id().isBlank()) {
                throw new IllegalStateException("Configured provider without id: " + provider.name());
            }
            Optional<Provider> stored = vocabularyRepository.findProvider(provider.id());
            if (stored.isEmpty()) {
                vocabularyRepository.insertProvider(provider);
                inserted++;
            } else if (!stored.get().equals(provider)) {
                vocabularyRepository.updateProvider(provider);
                updated++;
            }
        }
        if (inserted + updated > 0) {
            log.info("Providers synchronized: {} inserted, {} updated", inserted, updated);
        }
    }

    private Lookups loadLookups() {
        Map<String, MacroArea> macroAreas = new HashMap<>();
        for (MacroArea macroArea : vocabularyRepository.findAllMacroAreas()) {
            macroAreas.put(macroArea.name(), macroArea);
        }
        Map<String, Provider> providers = new HashMap<>();
        for (Provider provider : vocabularyRepository.findAllProviders()) {
            providers.put(Slugs.slug(provider.id()), provider);
        }
        Map<String, Doctype> doctypes = new HashMap<>();
        for (Doctype doctype : vocabularyRepository.findAllDoctypes()) {
            doctypes.put(doctype.name(), doctype);
        }

        Map<String, Languoid> languoids = null;
        if (properties.getImport().isLinkLanguoids()) {
            languoids = new HashMap<>();
            for (Languoid languoid : languoidRepository.findAll()) {
                if (languoid.hid() != null) {
                    languoids.put(languoid.hid(), languoid);
                }
                languoids.put(languoid.id(), languoid);
            }
        }
        return new Lookups(macroAreas, providers, doctypes, languoids);
    }

    /**
     * Name based lookup maps, read only after loading. languoidsByCode is null when
     * languoid linking is disabled.
     */
    record Lookups(
        Map<String, MacroArea> macroAreasByName,
        Map<String, Provider> providersBySlug,
        Map<String, Doctype> doctypesByName,
        Map<String, Languoid> languoidsByCode
    ) {}
}

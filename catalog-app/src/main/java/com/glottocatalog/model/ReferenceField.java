package com.glottocatalog.model;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Canonical, individually updatable fields of a {@link Reference}.
 *
 * key() is the name used in change logs, column() the name of the backing column.
 */
public enum ReferenceField {
    BIBTEX_TYPE("bibtex_type", String.class, Reference::getBibtexType, (r, v) -> r.setBibtexType((String) v)),
    AUTHOR("author", String.class, Reference::getAuthor, (r, v) -> r.setAuthor((String) v)),
    EDITOR("editor", String.class, Reference::getEditor, (r, v) -> r.setEditor((String) v)),
    YEAR("year", "year_text", String.class, Reference::getYear, (r, v) -> r.setYear((String) v)),
    TITLE("title", String.class, Reference::getTitle, (r, v) -> r.setTitle((String) v)),
    BOOKTITLE("booktitle", String.class, Reference::getBooktitle, (r, v) -> r.setBooktitle((String) v)),
    JOURNAL("journal", String.class, Reference::getJournal, (r, v) -> r.setJournal((String) v)),
    PUBLISHER("publisher", String.class, Reference::getPublisher, (r, v) -> r.setPublisher((String) v)),
    ADDRESS("address", String.class, Reference::getAddress, (r, v) -> r.setAddress((String) v)),
    EDITION("edition", String.class, Reference::getEdition, (r, v) -> r.setEdition((String) v)),
    NOTE("note", String.class, Reference::getNote, (r, v) -> r.setNote((String) v)),
    NUMBER("number", String.class, Reference::getNumber, (r, v) -> r.setNumber((String) v)),
    PAGES("pages", String.class, Reference::getPages, (r, v) -> r.setPages((String) v)),
    SCHOOL("school", String.class, Reference::getSchool, (r, v) -> r.setSchool((String) v)),
    SERIES("series", String.class, Reference::getSeries, (r, v) -> r.setSeries((String) v)),
    SUBJECT("subject", String.class, Reference::getSubject, (r, v) -> r.setSubject((String) v)),
    SUBJECT_HEADINGS("subject_headings", String.class, Reference::getSubjectHeadings, (r, v) -> r.setSubjectHeadings((String) v)),
    URL("url", String.class, Reference::getUrl, (r, v) -> r.setUrl((String) v)),
    VOLUME("volume", String.class, Reference::getVolume, (r, v) -> r.setVolume((String) v)),
    INLG("inlg", String.class, Reference::getInlg, (r, v) -> r.setInlg((String) v)),
    OZBIB_ID("ozbib_id", Integer.class, Reference::getOzbibId, (r, v) -> r.setOzbibId((Integer) v)),
    YEAR_INT("year_int", Integer.class, Reference::getYearInt, (r, v) -> r.setYearInt((Integer) v)),
    PAGES_INT("pages_int", Integer.class, Reference::getPagesInt, (r, v) -> r.setPagesInt((Integer) v)),
    STARTPAGE_INT("startpage_int", Integer.class, Reference::getStartpageInt, (r, v) -> r.setStartpageInt((Integer) v)),
    ENDPAGE_INT("endpage_int", Integer.class, Reference::getEndpageInt, (r, v) -> r.setEndpageInt((Integer) v));

    private final String key;
    private final String column;
    private final Class<?> type;
    private final Function<Reference, Object> getter;
    private final BiConsumer<Reference, Object> setter;

    ReferenceField(String key, Class<?> type, Function<Reference, Object> getter, BiConsumer<Reference, Object> setter) {
        this(key, key, type, getter, setter);
    }

    ReferenceField(String key, String column, Class<?> type,
                   Function<Reference, Object> getter, BiConsumer<Reference, Object> setter) {
        this.key = key;
        this.column = column;
        this.type = type;
        this.getter = getter;
        this.setter = setter;
    }

    public String key() { return key; }
    public String column() { return column; }
    public Class<?> type() { return type; }

    public Object get(Reference reference) {
        return getter.apply(reference);
    }

    public void set(Reference reference, Object value) {
        if (value != null && !type.isInstance(value)) {
            throw new IllegalArgumentException(
                "Field " + key + " expects " + type.getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
        setter.accept(reference, value);
    }
}

package com.glottocatalog.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical bibliographic entry. The pk is the permanent identifier assigned by the
 * source corpus, never generated here.
 *
 * Fields without a canonical target are kept verbatim in {@link #getJsondata()}.
 */
public class Reference {

    private final Long pk;
    private String id;
    private String name;
    private String description;
    private String bibtexType;
    private String author;
    private String editor;
    private String year;
    private String title;
    private String booktitle;
    private String journal;
    private String publisher;
    private String address;
    private String edition;
    private String note;
    private String number;
    private String pages;
    private String school;
    private String series;
    private String subject;
    private String subjectHeadings;
    private String url;
    private String volume;
    private String inlg;
    private Integer ozbibId;
    private Integer yearInt;
    private Integer pagesInt;
    private Integer startpageInt;
    private Integer endpageInt;
    private String doctypesStr;
    private String providersStr;
    private Map<String, String> jsondata = new LinkedHashMap<>();

    // Relationships, loaded by the repository
    private List<MacroArea> macroareas = new ArrayList<>();
    private List<Provider> providers = new ArrayList<>();
    private List<Doctype> doctypes = new ArrayList<>();
    private List<Languoid> languoids = new ArrayList<>();

    public Reference(Long pk) {
        this.pk = pk;
        this.id = pk != null ? String.valueOf(pk) : null;
    }

    public Object get(ReferenceField field) {
        return field.get(this);
    }

    public void set(ReferenceField field, Object value) {
        field.set(this, value);
    }

    /**
     * Keeps the description in lockstep with the title. Consumers read the description only.
     */
    public void mirrorTitle() {
        if (title != null && !title.isEmpty()) {
            description = title;
        }
    }

    // Getters
    public Long getPk() { return pk; }
    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public String getBibtexType() { return bibtexType; }
    public String getAuthor() { return author; }
    public String getEditor() { return editor; }
    public String getYear() { return year; }
    public String getTitle() { return title; }
    public String getBooktitle() { return booktitle; }
    public String getJournal() { return journal; }
    public String getPublisher() { return publisher; }
    public String getAddress() { return address; }
    public String getEdition() { return edition; }
    public String getNote() { return note; }
    public String getNumber() { return number; }
    public String getPages() { return pages; }
    public String getSchool() { return school; }
    public String getSeries() { return series; }
    public String getSubject() { return subject; }
    public String getSubjectHeadings() { return subjectHeadings; }
    public String getUrl() { return url; }
    public String getVolume() { return volume; }
    public String getInlg() { return inlg; }
    public Integer getOzbibId() { return ozbibId; }
    public Integer getYearInt() { return yearInt; }
    public Integer getPagesInt() { return pagesInt; }
    public Integer getStartpageInt() { return startpageInt; }
    public Integer getEndpageInt() { return endpageInt; }
    public String getDoctypesStr() { return doctypesStr; }
    public String getProvidersStr() { return providersStr; }
    public Map<String, String> getJsondata() { return jsondata; }
    public List<MacroArea> getMacroareas() { return macroareas; }
    public List<Provider> getProviders() { return providers; }
    public List<Doctype> getDoctypes() { return doctypes; }
    public List<Languoid> getLanguoids() { return languoids; }

    // Setters
    public void setId(String id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setDescription(String description) { this.description = description; }
    public void setBibtexType(String bibtexType) { this.bibtexType = bibtexType; }
    public void setAuthor(String author) { this.author = author; }
    public void setEditor(String editor) { this.editor = editor; }
    public void setYear(String year) { this.year = year; }
    public void setTitle(String title) { this.title = title; }
    public void setBooktitle(String booktitle) { this.booktitle = booktitle; }
    public void setJournal(String journal) { this.journal = journal; }
    public void setPublisher(String publisher) { this.publisher = publisher; }
    public void setAddress(String address) { this.address = address; }
    public void setEdition(String edition) { this.edition = edition; }
    public void setNote(String note) { this.note = note; }
    public void setNumber(String number) { this.number = number; }
    public void setPages(String pages) { this.pages = pages; }
    public void setSchool(String school) { this.school = school; }
    public void setSeries(String series) { this.series = series; }
    public void setSubject(String subject) { this.subject = subject; }
    public void setSubjectHeadings(String subjectHeadings) { this.subjectHeadings = subjectHeadings; }
    public void setUrl(String url) { this.url = url; }
    public void setVolume(String volume) { this.volume = volume; }
    public void setInlg(String inlg) { this.inlg = inlg; }
    public void setOzbibId(Integer ozbibId) { this.ozbibId = ozbibId; }
    public void setYearInt(Integer yearInt) { this.yearInt = yearInt; }
    public void setPagesInt(Integer pagesInt) { this.pagesInt = pagesInt; }
    public void setStartpageInt(Integer startpageInt) { this.startpageInt = startpageInt; }
    public void setEndpageInt(Integer endpageInt) { this.endpageInt = endpageInt; }
    public void setDoctypesStr(String doctypesStr) { this.doctypesStr = doctypesStr; }
    public void setProvidersStr(String providersStr) { this.providersStr = providersStr; }
    public void setJsondata(Map<String, String> jsondata) { this.jsondata = jsondata; }
    public void setMacroareas(List<MacroArea> macroareas) { this.macroareas = macroareas; }
    public void setProviders(List<Provider> providers) { this.providers = providers; }
    public void setDoctypes(List<Doctype> doctypes) { this.doctypes = doctypes; }
    public void setLanguoids(List<Languoid> languoids) { this.languoids = languoids; }
}

package com.sapa.speakers.model;

/**
 * Optional search predicates, AND-combined. A null or blank predicate places no constraint.
 */
public class SearchFilter {
    private String nameContains;
    private FieldSpecialty fieldSpecialty;
    private String affiliationContains;
    private ContactStatus contactStatus;
    private Priority priority;

    public static SearchFilter none() {
        return new SearchFilter();
    }

    public boolean isEmpty() {
        return isBlank(nameContains) && fieldSpecialty == null && isBlank(affiliationContains)
                && contactStatus == null && priority == null;
    }

    public String getNameContains() { return nameContains; }
    public void setNameContains(String nameContains) { this.nameContains = nameContains; }

    public FieldSpecialty getFieldSpecialty() { return fieldSpecialty; }
    public void setFieldSpecialty(FieldSpecialty fieldSpecialty) { this.fieldSpecialty = fieldSpecialty; }

    public String getAffiliationContains() { return affiliationContains; }
    public void setAffiliationContains(String affiliationContains) { this.affiliationContains = affiliationContains; }

    public ContactStatus getContactStatus() { return contactStatus; }
    public void setContactStatus(ContactStatus contactStatus) { this.contactStatus = contactStatus; }

    public Priority getPriority() { return priority; }
    public void setPriority(Priority priority) { this.priority = priority; }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

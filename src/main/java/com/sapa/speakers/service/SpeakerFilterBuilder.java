package com.sapa.speakers.service;

import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.LabeledOption;
import com.sapa.speakers.model.SearchFilter;
import com.sapa.speakers.notion.FilterExpression;

import java.util.ArrayList;
import java.util.List;

public class SpeakerFilterBuilder {

    /**
     * Returns null when the filter has no predicates, a single condition when it has one,
     * and an AND of all conditions otherwise.
     */
    public static FilterExpression build(SearchFilter filter) {
        if (filter == null) return null;
        List<FilterExpression> andClauses = new ArrayList<>();
        if (hasText(filter.getNameContains())) {
            andClauses.add(condition(SpeakerProperty.NAME, "contains", filter.getNameContains().trim()));
        }
        if (filter.getFieldSpecialty() != null) {
            andClauses.add(equalsOption(SpeakerProperty.FIELD_SPECIALTY, filter.getFieldSpecialty()));
        }
        if (hasText(filter.getAffiliationContains())) {
            andClauses.add(condition(SpeakerProperty.AFFILIATION, "contains", filter.getAffiliationContains().trim()));
        }
        if (filter.getContactStatus() != null) {
            andClauses.add(equalsOption(SpeakerProperty.CONTACT_STATUS, filter.getContactStatus()));
        }
        if (filter.getPriority() != null) {
            andClauses.add(equalsOption(SpeakerProperty.PRIORITY, filter.getPriority()));
        }
        if (andClauses.isEmpty()) return null;
        return andClauses.size() == 1 ? andClauses.get(0) : new FilterExpression.And(andClauses);
    }

    private static FilterExpression equalsOption(SpeakerProperty property, LabeledOption option) {
        // The sentinel has no remote option to match against
        if (!option.isRecognized()) {
            throw new SpeakerValidationException(property.propertyName(),
                    "Cannot filter on an unrecognized " + property.propertyName() + " value");
        }
        return condition(property, "equals", option.label());
    }

    private static FilterExpression condition(SpeakerProperty property, String operator, String value) {
        return new FilterExpression.Condition(property.propertyName(), property.kind(), operator, value);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}

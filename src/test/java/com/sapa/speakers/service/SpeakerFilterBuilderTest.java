package com.sapa.speakers.service;

import com.sapa.speakers.exception.SpeakerValidationException;
import com.sapa.speakers.model.FieldSpecialty;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.SearchFilter;
import com.sapa.speakers.notion.FilterExpression;
import com.sapa.speakers.notion.PropertyKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpeakerFilterBuilderTest {

    @Test
    public void emptyFilterProducesNoClause() {
        assertNull(SpeakerFilterBuilder.build(SearchFilter.none()));
        assertNull(SpeakerFilterBuilder.build(null));

        SearchFilter blanks = new SearchFilter();
        blanks.setNameContains(" ");
        blanks.setAffiliationContains("");
        assertNull(SpeakerFilterBuilder.build(blanks));
    }

    @Test
    public void singlePredicateIsNotWrapped() {
        SearchFilter f = new SearchFilter();
        f.setNameContains(" Smith ");

        FilterExpression expr = SpeakerFilterBuilder.build(f);

        assertEquals(new FilterExpression.Condition("Name", PropertyKind.TITLE, "contains", "Smith"), expr);
    }

    @Test
    public void specialtyAndPriorityAreAndCombined() {
        SearchFilter f = new SearchFilter();
        f.setFieldSpecialty(FieldSpecialty.NLP_HEALTHCARE);
        f.setPriority(Priority.HIGH);

        FilterExpression expr = SpeakerFilterBuilder.build(f);

        assertEquals(new FilterExpression.And(List.of(
                new FilterExpression.Condition("Field/Specialty", PropertyKind.SELECT, "equals", "NLP in Healthcare"),
                new FilterExpression.Condition("Priority", PropertyKind.SELECT, "equals", "High"))), expr);
    }

    @Test
    public void affiliationUsesRichTextContains() {
        SearchFilter f = new SearchFilter();
        f.setAffiliationContains("Stanford");
        f.setNameContains("Jane");

        FilterExpression.And and = (FilterExpression.And) SpeakerFilterBuilder.build(f);

        assertEquals(2, and.clauses().size());
        assertEquals(new FilterExpression.Condition("Affiliation", PropertyKind.RICH_TEXT, "contains", "Stanford"),
                and.clauses().get(1));
    }

    @Test
    public void sentinelCannotBeFilteredOn() {
        SearchFilter f = new SearchFilter();
        f.setPriority(Priority.UNRECOGNIZED);

        assertThrows(SpeakerValidationException.class, () -> SpeakerFilterBuilder.build(f));
    }
}

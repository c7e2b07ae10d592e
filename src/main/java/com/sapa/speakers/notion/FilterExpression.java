package com.sapa.speakers.notion;

import java.util.List;

/**
 * Notion database query filter: a single property condition or an AND of several.
 */
public sealed interface FilterExpression {

    /** e.g. property "Name", kind TITLE, operator "contains", value "Smith". */
    record Condition(String property, PropertyKind kind, String operator, String value) implements FilterExpression {
    }

    record And(List<FilterExpression> clauses) implements FilterExpression {
        public And {
            clauses = List.copyOf(clauses);
        }
    }
}

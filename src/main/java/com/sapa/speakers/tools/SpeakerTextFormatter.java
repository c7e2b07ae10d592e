package com.sapa.speakers.tools;

import com.sapa.speakers.model.ConnectionStatus;
import com.sapa.speakers.model.LabeledOption;
import com.sapa.speakers.model.Speaker;
import com.sapa.speakers.model.SpeakerListing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plain-text renderings returned by the speaker tools.
 */
public final class SpeakerTextFormatter {

    private SpeakerTextFormatter() {
    }

    public static String added(Speaker s) {
        return "Successfully added speaker '" + s.getName() + "' to the database.\n"
                + "Notion Page ID: " + s.getId() + "\n"
                + "URL: " + orDefault(s.getUrl(), "N/A");
    }

    public static String updated(Speaker s) {
        return "Successfully updated speaker '" + s.getName() + "'.\n"
                + "Notion Page ID: " + s.getId() + "\n"
                + "Status: " + s.getContactStatus().label();
    }

    public static String archived(String speakerId) {
        return "Archived speaker " + speakerId + ". It can be restored from the Notion trash.";
    }

    public static String searchResults(List<Speaker> speakers) {
        if (speakers.isEmpty()) {
            return "No speakers found matching the criteria.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Found " + speakers.size() + " speaker(s):\n");
        for (Speaker s : speakers) {
            lines.add("---");
            lines.add("Name: " + s.getName());
            lines.add("ID: " + s.getId());
            if (s.getFieldSpecialty() != null) lines.add("Field: " + s.getFieldSpecialty().label());
            if (s.getAffiliation() != null) lines.add("Affiliation: " + s.getAffiliation());
            if (s.getPosition() != null) lines.add("Position: " + s.getPosition());
            lines.add("Status: " + s.getContactStatus().label());
            if (s.getPriority() != null) lines.add("Priority: " + s.getPriority().label());
            if (s.getEmail() != null) lines.add("Email: " + s.getEmail());
        }
        return String.join("\n", lines);
    }

    public static String listing(SpeakerListing listing) {
        if (listing.getTotal() == 0) {
            return "No speakers in the database yet.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("Total speakers: " + listing.getTotal() + "\n");
        if (!listing.isGrouped()) {
            listing.getSpeakers().forEach(s -> lines.add(summaryLine(s)));
            return String.join("\n", lines);
        }
        for (Map.Entry<String, List<Speaker>> group : listing.getGroups().entrySet()) {
            lines.add("\n## " + group.getKey() + " (" + group.getValue().size() + ")");
            group.getValue().forEach(s -> lines.add(summaryLine(s)));
        }
        return String.join("\n", lines);
    }

    private static String summaryLine(Speaker s) {
        StringBuilder line = new StringBuilder("- ").append(s.getName());
        if (s.getAffiliation() != null) line.append(" (").append(s.getAffiliation()).append(')');
        if (s.getPriority() != null) line.append(" [").append(s.getPriority().label()).append(']');
        return line.toString();
    }

    public static String details(Speaker s) {
        List<String> lines = new ArrayList<>(List.of(
                "# " + s.getName(),
                "",
                "**Notion ID:** " + s.getId(),
                "**Notion URL:** " + orDefault(s.getUrl(), "N/A"),
                "",
                "## Professional Info",
                "- **Field/Specialty:** " + labelOr(s.getFieldSpecialty(), "Not specified"),
                "- **Affiliation:** " + orDefault(s.getAffiliation(), "Not specified"),
                "- **Position:** " + orDefault(s.getPosition(), "Not specified"),
                "",
                "## Contact",
                "- **Email:** " + orDefault(s.getEmail(), "Not specified"),
                "- **LinkedIn:** " + orDefault(s.getLinkedinUrl(), "Not specified"),
                "- **Status:** " + s.getContactStatus().label(),
                "- **Priority:** " + labelOr(s.getPriority(), "Not set"),
                "",
                "## Potential Topics"));
        if (s.getPotentialTopics().isEmpty()) {
            lines.add("- None specified");
        } else {
            s.getPotentialTopics().forEach(t -> lines.add("- " + t));
        }
        lines.add("");
        lines.add("## Research Notes");
        lines.add(orDefault(s.getResearchNotes(), "No notes yet."));
        return String.join("\n", lines);
    }

    public static String researchSummary(ResearchSummary r) {
        StringBuilder out = new StringBuilder();
        out.append("# Research Summary: ").append(r.name()).append("\n\n");
        out.append("## Professional Profile\n");
        out.append("- **Name:** ").append(r.name()).append('\n');
        out.append("- **Position:** ").append(r.position()).append('\n');
        out.append("- **Affiliation:** ").append(r.affiliation()).append('\n');
        out.append("- **Field:** ").append(r.fieldSpecialty()).append("\n\n");
        out.append("## Background\n").append(r.background()).append("\n\n");
        out.append("## Notable Work & Achievements\n").append(r.notableWork()).append("\n\n");
        out.append("## Potential Speaking Topics\n");
        for (String topic : r.potentialTopics()) {
            out.append("- ").append(topic).append('\n');
        }
        out.append("\n## Contact Information\n");
        out.append("- **LinkedIn:** ").append(orDefault(r.linkedinUrl(), "Not found")).append('\n');
        out.append("- **Email:** ").append(orDefault(r.email(), "Not found")).append("\n\n");
        out.append("## Recommendation\n");
        out.append("- **Priority:** ").append(r.priorityRecommendation()).append("\n\n");
        out.append("---\n");
        out.append("**To add this speaker, confirm and the add_speaker tool will be called with the above information.**\n");
        return out.toString();
    }

    public static String connection(ConnectionStatus status) {
        if (!status.isSuccess()) {
            return "Connection failed: " + status.getError();
        }
        StringBuilder out = new StringBuilder("Connection successful!\n")
                .append("Database: ").append(status.getDatabaseTitle()).append('\n')
                .append("Database ID: ").append(status.getDatabaseId());
        if (!status.getSchemaProblems().isEmpty()) {
            out.append("\nSchema problems:");
            status.getSchemaProblems().forEach(p -> out.append("\n- ").append(p));
        }
        return out.toString();
    }

    private static String labelOr(LabeledOption option, String fallback) {
        return option == null ? fallback : option.label();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}

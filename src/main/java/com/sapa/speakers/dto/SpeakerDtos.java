package com.sapa.speakers.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SpeakerDtos {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CreateSpeakerRequest {
        @NotBlank
        private String name;
        private String fieldSpecialty;
        private String affiliation;
        private String position;
        private String linkedinUrl;
        private List<String> potentialTopics;
        private String contactStatus;
        private String researchNotes;
        private String email;
        private String priority;

        /** Same keys the add_speaker tool takes; unset fields are left out. */
        public Map<String, Object> toArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("name", name);
            putIfPresent(args, "field_specialty", fieldSpecialty);
            putIfPresent(args, "affiliation", affiliation);
            putIfPresent(args, "position", position);
            putIfPresent(args, "linkedin_url", linkedinUrl);
            putIfPresent(args, "potential_topics", potentialTopics);
            putIfPresent(args, "contact_status", contactStatus);
            putIfPresent(args, "research_notes", researchNotes);
            putIfPresent(args, "email", email);
            putIfPresent(args, "priority", priority);
            return args;
        }

        private static void putIfPresent(Map<String, Object> args, String key, Object value) {
            if (value != null) args.put(key, value);
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getFieldSpecialty() { return fieldSpecialty; }
        public void setFieldSpecialty(String fieldSpecialty) { this.fieldSpecialty = fieldSpecialty; }
        public String getAffiliation() { return affiliation; }
        public void setAffiliation(String affiliation) { this.affiliation = affiliation; }
        public String getPosition() { return position; }
        public void setPosition(String position) { this.position = position; }
        public String getLinkedinUrl() { return linkedinUrl; }
        public void setLinkedinUrl(String linkedinUrl) { this.linkedinUrl = linkedinUrl; }
        public List<String> getPotentialTopics() { return potentialTopics; }
        public void setPotentialTopics(List<String> potentialTopics) { this.potentialTopics = potentialTopics; }
        public String getContactStatus() { return contactStatus; }
        public void setContactStatus(String contactStatus) { this.contactStatus = contactStatus; }
        public String getResearchNotes() { return researchNotes; }
        public void setResearchNotes(String researchNotes) { this.researchNotes = researchNotes; }
        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getPriority() { return priority; }
        public void setPriority(String priority) { this.priority = priority; }
    }

    public static class SpeakerSearchResponse<T> {
        private List<T> items;
        private long total;

        public SpeakerSearchResponse() {
        }

        public SpeakerSearchResponse(List<T> items) {
            this.items = items;
            this.total = items.size();
        }

        public List<T> getItems() { return items; }
        public void setItems(List<T> items) { this.items = items; }
        public long getTotal() { return total; }
        public void setTotal(long total) { this.total = total; }
    }
}

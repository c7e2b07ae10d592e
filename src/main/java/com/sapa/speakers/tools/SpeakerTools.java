package com.sapa.speakers.tools;

import com.sapa.speakers.config.AppProperties;
import com.sapa.speakers.model.ContactStatus;
import com.sapa.speakers.model.FieldSpecialty;
import com.sapa.speakers.model.Priority;
import com.sapa.speakers.model.SpeakerGrouping;
import com.sapa.speakers.service.SpeakerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static com.sapa.speakers.tools.SpeakerArgumentParser.AFFILIATION;
import static com.sapa.speakers.tools.SpeakerArgumentParser.CONTACT_STATUS;
import static com.sapa.speakers.tools.SpeakerArgumentParser.EMAIL;
import static com.sapa.speakers.tools.SpeakerArgumentParser.FIELD_SPECIALTY;
import static com.sapa.speakers.tools.SpeakerArgumentParser.LINKEDIN_URL;
import static com.sapa.speakers.tools.SpeakerArgumentParser.NAME;
import static com.sapa.speakers.tools.SpeakerArgumentParser.POSITION;
import static com.sapa.speakers.tools.SpeakerArgumentParser.POTENTIAL_TOPICS;
import static com.sapa.speakers.tools.SpeakerArgumentParser.PRIORITY;
import static com.sapa.speakers.tools.SpeakerArgumentParser.RESEARCH_NOTES;
import static com.sapa.speakers.tools.SpeakerArgumentParser.SPEAKER_ID;

/**
 * The speaker actions exposed to the assistant. Each handler renders its result as text and
 * reports failures as an "Error ...: message" line.
 */
@Component
public class SpeakerTools {
    private static final Logger log = LoggerFactory.getLogger(SpeakerTools.class);

    private final SpeakerRepository repository;
    private final AppProperties appProperties;

    public SpeakerTools(SpeakerRepository repository, AppProperties appProperties) {
        this.repository = repository;
        this.appProperties = appProperties;
    }

    public void registerAll(ToolRegistry registry) {
        registry.register(new ToolDefinition("add_speaker",
                "Add a new speaker to the SAPA speaker database.",
                speakerFields(ToolParameter.required(NAME, "string", "Speaker's full name"),
                        ToolParameter.choice(CONTACT_STATUS, false, "Contact status, defaults to Not Contacted", ContactStatus.labels())),
                guarded("Error adding speaker", args -> repository.addSpeaker(SpeakerArgumentParser.toCreate(args))
                        .map(SpeakerTextFormatter::added))));

        registry.register(new ToolDefinition("search_speakers",
                "Search for speakers with optional filters; all given filters must match.",
                List.of(ToolParameter.optional(NAME, "string", "Partial name match"),
                        ToolParameter.choice(FIELD_SPECIALTY, false, "Field/specialty", FieldSpecialty.labels()),
                        ToolParameter.optional(AFFILIATION, "string", "Partial affiliation match"),
                        ToolParameter.choice(CONTACT_STATUS, false, "Contact status", ContactStatus.labels()),
                        ToolParameter.choice(PRIORITY, false, "Priority level", Priority.labels()),
                        ToolParameter.optional("limit", "integer", "Maximum number of speakers to return")),
                guarded("Error searching speakers", args -> repository
                        .searchSpeakers(SpeakerArgumentParser.toFilter(args), args.integer("limit"))
                        .map(SpeakerTextFormatter::searchResults))));

        registry.register(new ToolDefinition("update_speaker",
                "Update an existing speaker. Only the given fields change; pass an empty value to clear a field.",
                speakerFields(ToolParameter.required(SPEAKER_ID, "string", "Notion page ID of the speaker"),
                        ToolParameter.optional(NAME, "string", "New name"),
                        ToolParameter.choice(CONTACT_STATUS, false, "New contact status", ContactStatus.labels())),
                guarded("Error updating speaker", args -> repository
                        .updateSpeaker(args.requiredText(SPEAKER_ID), SpeakerArgumentParser.toUpdate(args))
                        .map(SpeakerTextFormatter::updated))));

        registry.register(new ToolDefinition("list_speakers",
                "List speakers in the database, grouped by contact status unless another grouping is given.",
                List.of(ToolParameter.optional("limit", "integer",
                                "Maximum number of speakers to return (default " + appProperties.getListDefaultLimit() + ")"),
                        ToolParameter.choice("group_by", false, "Grouping key, defaults to contact_status",
                                Arrays.stream(SpeakerGrouping.values()).map(SpeakerGrouping::key).toList())),
                guarded("Error listing speakers", args -> {
                    Integer limit = args.integer("limit");
                    String groupBy = args.textOrDefault("group_by", SpeakerGrouping.CONTACT_STATUS.key());
                    return repository.listSpeakers(SpeakerGrouping.fromKey(groupBy),
                                    limit == null ? appProperties.getListDefaultLimit() : limit)
                            .map(SpeakerTextFormatter::listing);
                })));

        registry.register(new ToolDefinition("get_speaker_details",
                "Get the full record of one speaker.",
                List.of(ToolParameter.required(SPEAKER_ID, "string", "Notion page ID of the speaker")),
                guarded("Error getting speaker details", args -> repository.getSpeaker(args.requiredText(SPEAKER_ID))
                        .map(SpeakerTextFormatter::details))));

        registry.register(new ToolDefinition("archive_speaker",
                "Archive a speaker. Notion keeps archived pages in its trash, so this can be undone there.",
                List.of(ToolParameter.required(SPEAKER_ID, "string", "Notion page ID of the speaker")),
                guarded("Error archiving speaker", args -> {
                    String id = args.requiredText(SPEAKER_ID);
                    return repository.archiveSpeaker(id).thenReturn(SpeakerTextFormatter.archived(id));
                })));

        registry.register(new ToolDefinition("prepare_research_summary",
                "Format web research about a prospective speaker for review before adding them. Makes no database call.",
                List.of(ToolParameter.required(NAME, "string", "Speaker's full name"),
                        ToolParameter.required(AFFILIATION, "string", "University or company"),
                        ToolParameter.required(POSITION, "string", "Job title"),
                        new ToolParameter(FIELD_SPECIALTY, "string", true, "Primary field", FieldSpecialty.labels()),
                        ToolParameter.required("background", "string", "Brief biography"),
                        ToolParameter.required("notable_work", "string", "Key publications, projects or achievements"),
                        ToolParameter.required(POTENTIAL_TOPICS, "array", "Topics they could speak on"),
                        ToolParameter.optional(LINKEDIN_URL, "string", "LinkedIn profile URL if found"),
                        ToolParameter.optional(EMAIL, "string", "Contact email if found"),
                        ToolParameter.choice("priority_recommendation", false, "Suggested priority, defaults to Medium", Priority.labels())),
                guarded("Error preparing research summary", args -> Mono.just(
                        SpeakerTextFormatter.researchSummary(researchSummary(args))))));

        registry.register(new ToolDefinition("test_connection",
                "Check that the Notion database is reachable and has the expected properties.",
                List.of(),
                guarded("Connection error", args -> repository.testConnection()
                        .map(SpeakerTextFormatter::connection))));
    }

    private static ResearchSummary researchSummary(ToolArguments args) {
        List<String> topics = args.stringList(POTENTIAL_TOPICS);
        return new ResearchSummary(
                args.requiredText(NAME),
                args.requiredText(AFFILIATION),
                args.requiredText(POSITION),
                FieldSpecialty.fromLabel(args.requiredText(FIELD_SPECIALTY)).label(),
                args.requiredText("background"),
                args.requiredText("notable_work"),
                topics == null ? List.of() : topics,
                args.text(LINKEDIN_URL),
                args.text(EMAIL),
                Priority.fromLabel(args.textOrDefault("priority_recommendation", Priority.MEDIUM.label())).label());
    }

    /** The ten speaker fields, led by the tool-specific parameters. */
    private static List<ToolParameter> speakerFields(ToolParameter... leading) {
        List<ToolParameter> out = new ArrayList<>(Arrays.asList(leading));
        out.add(ToolParameter.choice(FIELD_SPECIALTY, false, "Primary field", FieldSpecialty.labels()));
        out.add(ToolParameter.optional(AFFILIATION, "string", "University or company name"));
        out.add(ToolParameter.optional(POSITION, "string", "Job title"));
        out.add(ToolParameter.optional(LINKEDIN_URL, "string", "LinkedIn profile URL"));
        out.add(ToolParameter.optional(POTENTIAL_TOPICS, "array", "Topics they could speak on"));
        out.add(ToolParameter.optional(RESEARCH_NOTES, "string", "Bio summary and research findings"));
        out.add(ToolParameter.optional(EMAIL, "string", "Contact email address"));
        out.add(ToolParameter.choice(PRIORITY, false, "Priority level", Priority.labels()));
        return out;
    }

    private static Function<ToolArguments, Mono<String>> guarded(String errorPrefix, Function<ToolArguments, Mono<String>> body) {
        return args -> Mono.defer(() -> body.apply(args))
                .onErrorResume(e -> {
                    log.warn("{}: {}", errorPrefix, e.getMessage());
                    return Mono.just(errorPrefix + ": " + e.getMessage());
                });
    }
}

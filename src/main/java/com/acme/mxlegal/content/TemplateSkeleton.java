package com.acme.mxlegal.content;

import com.acme.mxlegal.model.Enums.DocumentType;

import java.util.*;

/**
 * Fixed section layout of one document type. Bodies use {@code {{field}}} for text and
 * {@code {{#field}}} for an enumerated list.
 */
public record TemplateSkeleton(
        DocumentType documentType,
        HeadingStyle headingStyle,
        List<SectionTemplate> sections,
        Set<String> requiredFields,
        Set<String> listFields,
        Map<String, String> textDefaults,
        Set<String> dateDefaults
) {
    public TemplateSkeleton {
        sections = List.copyOf(sections);
        requiredFields = Collections.unmodifiableSet(new LinkedHashSet<>(requiredFields));
        listFields = Set.copyOf(listFields);
        textDefaults = Map.copyOf(textDefaults);
        dateDefaults = Set.copyOf(dateDefaults);
    }

    public Set<String> knownFields() {
        Set<String> out = new LinkedHashSet<>(requiredFields);
        out.addAll(textDefaults.keySet());
        out.addAll(dateDefaults);
        for (SectionTemplate s : sections) if (s.onlyIfPresent() != null) out.add(s.onlyIfPresent());
        return out;
    }

    public enum HeadingStyle {
        UPPER, AS_IS;

        public String apply(String title) {
            return this == UPPER ? title.toUpperCase(Locale.ROOT) : title;
        }
    }

    // onlyIfPresent: section is dropped unless that field has content
    public record SectionTemplate(String title, String body, String onlyIfPresent) {}

    public static Builder builder(DocumentType type) { return new Builder(type); }

    public static final class Builder {
        private final DocumentType type;
        private HeadingStyle headingStyle = HeadingStyle.UPPER;
        private final List<SectionTemplate> sections = new ArrayList<>();
        private final Set<String> required = new LinkedHashSet<>();
        private final Set<String> lists = new HashSet<>();
        private final Map<String, String> textDefaults = new LinkedHashMap<>();
        private final Set<String> dateDefaults = new LinkedHashSet<>();

        private Builder(DocumentType type) { this.type = type; }

        public Builder headingStyle(HeadingStyle style) { this.headingStyle = style; return this; }
        public Builder required(String... fields) { required.addAll(List.of(fields)); return this; }
        public Builder lists(String... fields) { lists.addAll(List.of(fields)); return this; }
        public Builder textDefault(String field, String value) { textDefaults.put(field, value); return this; }
        public Builder dateDefault(String field) { dateDefaults.add(field); return this; }
        public Builder section(String title, String body) { sections.add(new SectionTemplate(title, body, null)); return this; }
        public Builder sectionIf(String field, String title, String body) { sections.add(new SectionTemplate(title, body, field)); return this; }

        public TemplateSkeleton build() {
            return new TemplateSkeleton(type, headingStyle, sections, required, lists, textDefaults, dateDefaults);
        }
    }
}

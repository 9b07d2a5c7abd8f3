package com.acme.mxlegal.documents;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.TemplateSkeleton;
import com.acme.mxlegal.content.TemplateSkeleton.SectionTemplate;
import com.acme.mxlegal.model.DocumentRequest;
import com.acme.mxlegal.model.GeneratedDocument;
import com.acme.mxlegal.model.GeneratedDocument.Section;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import com.acme.mxlegal.rules.Check;
import com.acme.mxlegal.util.FieldUtil;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a {@link DocumentRequest} against its skeleton. Caller text is substituted verbatim in a
 * single pass, so placeholder-like text inside a value is never expanded.
 */
public final class DocumentTemplateEngine implements Check<DocumentRequest, GeneratedDocument> {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(#?)([a-z0-9_]+)}}");
    private static final DateTimeFormatter SPANISH_DATE =
            DateTimeFormatter.ofPattern("d 'de' MMMM 'de' yyyy", new Locale("es", "MX"));

    private final LegalContentLibrary library;
    private final Clock clock;

    public DocumentTemplateEngine(LegalContentLibrary library, Clock clock) {
        this.library = Objects.requireNonNull(library);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override public String id() { return "document-generation"; }

    @Override
    public GeneratedDocument run(DocumentRequest input) { return render(input); }

    public GeneratedDocument render(DocumentRequest request) {
        TemplateSkeleton skeleton = library.getTemplate(request.documentType());
        Map<String, Object> fields = request.fields();

        List<String> missing = new ArrayList<>();
        for (String f : skeleton.requiredFields()) {
            if (!FieldUtil.isPresent(fields.get(f))) missing.add(f);
        }
        if (!missing.isEmpty()) throw new LegalException(LegalError.missingFields(missing));

        Instant generatedAt = clock.instant();
        Map<String, Object> values = withDefaults(skeleton, fields, LocalDate.ofInstant(generatedAt, clock.getZone()));

        List<Section> sections = new ArrayList<>();
        for (SectionTemplate st : skeleton.sections()) {
            if (st.onlyIfPresent() != null && !FieldUtil.isPresent(values.get(st.onlyIfPresent()))) continue;
            String title = skeleton.headingStyle().apply(substitute(st.title(), values));
            sections.add(new Section(title, substitute(st.body(), values)));
        }

        StringJoiner text = new StringJoiner("\n\n");
        for (Section s : sections) {
            text.add(s.title().isEmpty() ? s.body() : s.title() + "\n" + s.body());
        }
        return new GeneratedDocument(skeleton.documentType(), text.toString(), sections, generatedAt);
    }

    static Map<String, Object> withDefaults(TemplateSkeleton skeleton, Map<String, Object> fields, LocalDate today) {
        Map<String, Object> values = new HashMap<>(fields);
        for (var e : skeleton.textDefaults().entrySet()) {
            if (!FieldUtil.isPresent(values.get(e.getKey()))) values.put(e.getKey(), e.getValue());
        }
        for (String f : skeleton.dateDefaults()) {
            if (!FieldUtil.isPresent(values.get(f))) values.put(f, SPANISH_DATE.format(today));
        }
        return values;
    }

    static String substitute(String template, Map<String, Object> values) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            boolean list = !m.group(1).isEmpty();
            Object value = values.get(m.group(2));
            String replacement = list ? enumerate(FieldUtil.asList(value)) : FieldUtil.asText(value);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String enumerate(List<Object> items) {
        StringJoiner sj = new StringJoiner("\n");
        int i = 1;
        for (Object item : items) sj.add((i++) + ".- " + entryText(item));
        return sj.toString();
    }

    // Heir entries of a will arrive as {nombre, porcentaje, parentesco}.
    static String entryText(Object item) {
        if (!(item instanceof Map<?, ?> m)) return FieldUtil.asText(item);
        if (m.containsKey("nombre")) {
            StringBuilder sb = new StringBuilder(FieldUtil.asText(m.get("nombre")));
            if (m.get("porcentaje") != null) sb.append(" - ").append(FieldUtil.asText(m.get("porcentaje"))).append('%');
            if (m.get("parentesco") != null) sb.append(" - ").append(FieldUtil.asText(m.get("parentesco")));
            return sb.toString();
        }
        StringJoiner sj = new StringJoiner(" - ");
        for (Object v : m.values()) sj.add(FieldUtil.asText(v));
        return sj.toString();
    }
}

package com.acme.mxlegal.content;

import com.acme.mxlegal.model.Enums.DocumentType;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;

import java.util.*;

public final class LegalContentLibrary {

    public static final String DISCLAIMER =
            "AVISO: Este resultado se obtiene por coincidencia de palabras clave contra una base de conocimiento fija. "
            + "No constituye asesoría legal, no garantiza la vigencia ni la exactitud de la legislación citada "
            + "y no sustituye la opinión de un abogado. Consulte a un profesional del derecho antes de actuar.";

    private static final LegalContentLibrary STANDARD = new LegalContentLibrary(
            DocumentSkeletons.all(), RuleTables.all(), ReferenceCatalog.standard(), DISCLAIMER);

    private final Map<DocumentType, TemplateSkeleton> templates;
    private final Map<LegalArea, RuleTable> ruleTables;
    private final ReferenceCatalog catalog;
    private final String disclaimer;

    public LegalContentLibrary(Map<DocumentType, TemplateSkeleton> templates, Map<LegalArea, RuleTable> ruleTables,
                               ReferenceCatalog catalog, String disclaimer) {
        if (disclaimer == null || disclaimer.isBlank()) throw new IllegalArgumentException("disclaimer is mandatory");
        this.templates = templates.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(templates));
        this.ruleTables = ruleTables.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(ruleTables));
        this.catalog = Objects.requireNonNull(catalog);
        this.disclaimer = disclaimer;
    }

    public static LegalContentLibrary standard() { return STANDARD; }

    public TemplateSkeleton getTemplate(DocumentType type) {
        TemplateSkeleton t = type == null ? null : templates.get(type);
        if (t == null) throw new LegalException(LegalError.unknownDocumentType(String.valueOf(type)));
        return t;
    }

    public RuleTable getRuleTable(LegalArea area) {
        RuleTable t = area == null ? null : ruleTables.get(area);
        if (t == null) throw new LegalException(LegalError.unknownArea(String.valueOf(area)));
        return t;
    }

    public Set<String> getRequiredFields(DocumentType type) {
        return getTemplate(type).requiredFields();
    }

    public Map<DocumentType, Set<String>> availableTemplates() {
        Map<DocumentType, Set<String>> out = new LinkedHashMap<>();
        for (var e : templates.entrySet()) out.put(e.getKey(), e.getValue().requiredFields());
        return out;
    }

    public ReferenceCatalog catalog() { return catalog; }

    public String disclaimer() { return disclaimer; }
}

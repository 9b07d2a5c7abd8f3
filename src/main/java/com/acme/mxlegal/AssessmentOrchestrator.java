package com.acme.mxlegal;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.TemplateSkeleton;
import com.acme.mxlegal.documents.DocumentTemplateEngine;
import com.acme.mxlegal.model.*;
import com.acme.mxlegal.model.Enums.DocumentType;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.rules.*;
import com.acme.mxlegal.util.FieldUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;

/**
 * Single entry surface of the engine. Validates raw, JSON-shaped input, dispatches to the
 * template engine or one of the checks, and returns an {@link Outcome}; errors never escape as
 * exceptions.
 */
public final class AssessmentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AssessmentOrchestrator.class);

    public static final String DOCUMENT_TYPE = "documentType";
    public static final String FIELDS = "fields";
    public static final String FACTS = "facts";
    public static final String LEGAL_QUESTION = "legalQuestion";
    public static final String AREA = "area";

    private final LegalContentLibrary library;
    private final DocumentTemplateEngine templateEngine;
    private final LegalRuleEvaluator ruleEvaluator;
    private final AreaClassifier areaClassifier;
    private final ConstitutionalRightsCheck rightsCheck;
    private final ContractValidityCheck contractCheck;
    private final CriminalLiabilityCheck criminalCheck;

    public AssessmentOrchestrator(LegalContentLibrary library, Clock clock) {
        this.library = library;
        this.templateEngine = new DocumentTemplateEngine(library, clock);
        this.ruleEvaluator = new LegalRuleEvaluator(library);
        this.areaClassifier = new AreaClassifier(library);
        this.rightsCheck = new ConstitutionalRightsCheck(library);
        this.contractCheck = new ContractValidityCheck(library);
        this.criminalCheck = new CriminalLiabilityCheck(library);
    }

    public static AssessmentOrchestrator standard() {
        return new AssessmentOrchestrator(LegalContentLibrary.standard(), Clock.systemUTC());
    }

    public Outcome<GeneratedDocument> generateDocument(Map<String, Object> raw, RequestContext ctx) {
        ctx = orNew(ctx);
        List<String> invalid = new ArrayList<>();
        Object type = raw == null ? null : raw.get(DOCUMENT_TYPE);
        Object fields = raw == null ? null : raw.get(FIELDS);
        if (!(type instanceof String)) invalid.add(DOCUMENT_TYPE);
        if (!(fields instanceof Map<?, ?>)) invalid.add(FIELDS);
        if (!invalid.isEmpty()) return rejected(ctx, "generateDocument", LegalError.invalidInput(invalid));

        Optional<DocumentType> documentType = DocumentType.fromWire((String) type);
        if (documentType.isEmpty()) return rejected(ctx, "generateDocument", LegalError.unknownDocumentType((String) type));

        Map<String, Object> fieldMap = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) fields).entrySet()) fieldMap.put(String.valueOf(e.getKey()), e.getValue());

        try {
            List<String> badShape = shapeErrors(library.getTemplate(documentType.get()), fieldMap);
            if (!badShape.isEmpty()) return rejected(ctx, "generateDocument", LegalError.invalidInput(badShape));
        } catch (LegalException e) {
            return rejected(ctx, "generateDocument", e.error());
        }

        return dispatch(templateEngine, new DocumentRequest(documentType.get(), fieldMap), ctx);
    }

    public Outcome<AssessmentResult> analyzeCase(Map<String, Object> raw, RequestContext ctx) {
        ctx = orNew(ctx);
        List<String> invalid = new ArrayList<>();
        List<String> facts = raw == null ? null : FieldUtil.stringList(raw.get(FACTS));
        Object question = raw == null ? null : raw.get(LEGAL_QUESTION);
        Object area = raw == null ? null : raw.get(AREA);
        if (facts == null) invalid.add(FACTS);
        if (!(question instanceof String)) invalid.add(LEGAL_QUESTION);
        if (area != null && !(area instanceof String)) invalid.add(AREA);
        if (!invalid.isEmpty()) return rejected(ctx, "analyzeCase", LegalError.invalidInput(invalid));

        LegalArea legalArea;
        if (area == null || ((String) area).isBlank()) {
            legalArea = areaClassifier.classify(facts, (String) question);
            log.debug("[{}] area not given, classified as {}", ctx.requestId, legalArea);
        } else {
            Optional<LegalArea> parsed = LegalArea.fromWire((String) area);
            if (parsed.isEmpty()) return rejected(ctx, "analyzeCase", LegalError.unknownArea((String) area));
            legalArea = parsed.get();
        }

        return dispatch(ruleEvaluator, new CaseFacts(facts, (String) question, legalArea), ctx);
    }

    public Outcome<RightsCheckResult> checkConstitutionalRights(String situation, RequestContext ctx) {
        ctx = orNew(ctx);
        return dispatch(rightsCheck, situation, ctx);
    }

    public Outcome<ContractValidityResult> analyzeContractValidity(List<String> contractTerms, RequestContext ctx) {
        ctx = orNew(ctx);
        if (contractTerms == null) return rejected(ctx, "analyzeContractValidity", LegalError.invalidInput(List.of("contract_terms")));
        return dispatch(contractCheck, contractTerms, ctx);
    }

    public Outcome<CriminalLiabilityResult> assessCriminalLiability(List<String> facts, RequestContext ctx) {
        ctx = orNew(ctx);
        if (facts == null) return rejected(ctx, "assessCriminalLiability", LegalError.invalidInput(List.of(FACTS)));
        return dispatch(criminalCheck, facts, ctx);
    }

    public Outcome<LegalArea> identifyArea(List<String> facts, String legalQuestion, RequestContext ctx) {
        ctx = orNew(ctx);
        if (facts == null) return rejected(ctx, "identifyArea", LegalError.invalidInput(List.of(FACTS)));
        return dispatch(areaClassifier, new CaseFacts(facts, legalQuestion, null), ctx);
    }

    public Map<DocumentType, Set<String>> availableTemplates() {
        return library.availableTemplates();
    }

    private <I, R> Outcome<R> dispatch(Check<I, R> check, I input, RequestContext ctx) {
        if (ctx.isCancelled()) return rejected(ctx, check.id(), LegalError.cancelled(ctx.requestId));
        log.debug("[{}] running {}", ctx.requestId, check.id());
        try {
            return Outcome.ok(check.run(input));
        } catch (LegalException e) {
            return rejected(ctx, check.id(), e.error());
        }
    }

    private static RequestContext orNew(RequestContext ctx) {
        return ctx == null ? RequestContext.create() : ctx;
    }

    private static <R> Outcome<R> rejected(RequestContext ctx, String operation, LegalError error) {
        log.info("[{}] {} rejected: {} {}", ctx.requestId, operation, error.kind(), error.fields());
        return Outcome.failure(error);
    }

    // List fields must be arrays without blank entries; everything else the skeleton knows must be plain text or a number.
    static List<String> shapeErrors(TemplateSkeleton skeleton, Map<String, Object> fields) {
        List<String> bad = new ArrayList<>();
        for (String name : skeleton.knownFields()) {
            Object v = fields.get(name);
            if (v == null) continue;
            if (skeleton.listFields().contains(name)) {
                if (!(v instanceof Collection<?> c) || !c.stream().allMatch(o -> o == null || FieldUtil.isScalar(o) || o instanceof Map<?, ?>)) {
                    bad.add(FIELDS + "." + name);
                } else if (FieldUtil.isPresent(c) && FieldUtil.hasBlankEntry(c)) {
                    // a blank entry among real ones would shift the numbering
                    bad.add(FIELDS + "." + name);
                }
            } else if (!FieldUtil.isScalar(v)) {
                bad.add(FIELDS + "." + name);
            }
        }
        return bad;
    }
}

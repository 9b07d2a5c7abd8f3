package com.acme.mxlegal.content;

import com.acme.mxlegal.model.CriminalLiabilityResult.OffenseProfile;
import com.acme.mxlegal.model.Enums.LegalArea;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.acme.mxlegal.content.KeywordPredicate.anyOf;

public final class ReferenceCatalog {

    public record RightEntry(String right, String article, KeywordPredicate predicate) {}

    public record RequisiteEntry(String requisite, KeywordPredicate predicate, String issue, String recommendation) {}

    public record OffenseEntry(KeywordPredicate predicate, OffenseProfile profile) {}

    private final List<RightEntry> rights;
    private final List<RequisiteEntry> contractRequisites;
    private final List<String> contractArticles;
    private final List<OffenseEntry> offenses;
    private final List<String> criminalDefenses;
    private final Map<LegalArea, KeywordPredicate> areaKeywords;
    private final List<String> genericRecommendations;

    public ReferenceCatalog(List<RightEntry> rights, List<RequisiteEntry> contractRequisites, List<String> contractArticles,
                            List<OffenseEntry> offenses, List<String> criminalDefenses,
                            Map<LegalArea, KeywordPredicate> areaKeywords, List<String> genericRecommendations) {
        this.rights = List.copyOf(rights);
        this.contractRequisites = List.copyOf(contractRequisites);
        this.contractArticles = List.copyOf(contractArticles);
        this.offenses = List.copyOf(offenses);
        this.criminalDefenses = List.copyOf(criminalDefenses);
        // declaration order decides ties, so keep it
        this.areaKeywords = Collections.unmodifiableMap(new LinkedHashMap<>(areaKeywords));
        this.genericRecommendations = List.copyOf(genericRecommendations);
    }

    public List<RightEntry> rights() { return rights; }
    public List<RequisiteEntry> contractRequisites() { return contractRequisites; }
    public List<String> contractArticles() { return contractArticles; }
    public List<OffenseEntry> offenses() { return offenses; }
    public List<String> criminalDefenses() { return criminalDefenses; }
    public Map<LegalArea, KeywordPredicate> areaKeywords() { return areaKeywords; }
    public List<String> genericRecommendations() { return genericRecommendations; }

    static ReferenceCatalog standard() {
        return new ReferenceCatalog(rights0(), requisites0(),
                List.of("Código Civil Federal, art. 1794", "Código Civil Federal, art. 1795", "Código Civil Federal, art. 1796"),
                offenses0(),
                List.of("Legítima defensa (Código Penal Federal, art. 15, fracción IV)",
                        "Estado de necesidad (Código Penal Federal, art. 15, fracción V)",
                        "Error de tipo o de prohibición (Código Penal Federal, art. 15, fracción VIII)"),
                areas0(),
                List.of("Recabar toda la documentación probatoria disponible",
                        "Consultar con un abogado especializado en la materia",
                        "Evaluar las opciones procesales disponibles"));
    }

    private static List<RightEntry> rights0() {
        return List.of(
                new RightEntry("igualdad", "Artículo 1", anyOf("igualdad", "discrimin*", "trato desigual")),
                new RightEntry("educacion", "Artículo 3", anyOf("educacion", "escuela", "inscripcion escolar")),
                new RightEntry("libertad de trabajo", "Artículo 5", anyOf("libertad de trabajo", "impedir trabajar", "ejercer su profesion")),
                new RightEntry("libertad de expresion", "Artículo 6", anyOf("expresion", "censura", "opinion")),
                new RightEntry("peticion", "Artículo 8", anyOf("peticion", "sin respuesta", "solicitud")),
                new RightEntry("debido proceso", "Artículo 14", anyOf("debido proceso", "sin juicio", "sin audiencia", "proceso")),
                new RightEntry("legalidad", "Artículo 16", anyOf("legalidad", "sin orden", "sin fundamento", "cateo", "detencion")),
                new RightEntry("propiedad", "Artículo 27", anyOf("propiedad", "expropiacion", "despojo"))
        );
    }

    private static List<RequisiteEntry> requisites0() {
        return List.of(
                new RequisiteEntry("consentimiento",
                        anyOf("acepto", "aceptan", "aceptamos", "convenimos", "convienen", "acordamos", "acuerdan", "otorgan su consentimiento"),
                        "Falta expresión clara del consentimiento",
                        "Incluir cláusula expresa de aceptación de términos"),
                new RequisiteEntry("objeto",
                        anyOf("objeto", "prestacion", "obligacion", "se obliga*"),
                        "Objeto del contrato no está claramente definido",
                        "Definir claramente el objeto del contrato"),
                new RequisiteEntry("causa",
                        anyOf("porque", "motivo", "causa", "razon", "con el fin de", "finalidad"),
                        "Causa del contrato no está especificada",
                        "Expresar el motivo o fin determinante de la voluntad de las partes"),
                new RequisiteEntry("forma",
                        anyOf("por escrito", "firman", "firma", "firmado*", "escritura publica", "ante notario"),
                        "No consta la forma en que se otorga el contrato",
                        "Otorgar el contrato por escrito y con firma de las partes cuando la ley lo exija")
        );
    }

    private static List<OffenseEntry> offenses0() {
        return List.of(
                new OffenseEntry(anyOf("matar", "mataron", "mato", "muerte", "asesin*", "privo de la vida", "homicidio"),
                        new OffenseProfile("homicidio", "Código Penal Federal, art. 302",
                                List.of("Privar de la vida a otro", "Dolo o culpa", "Nexo causal entre la conducta y el resultado"),
                                "12 a 24 años de prisión para el homicidio simple intencional (art. 307)")),
                new OffenseEntry(anyOf("robar*", "robo", "robos", "robado*", "sustraer", "sustrajo", "sustrajeron", "hurt*", "apodero"),
                        new OffenseProfile("robo", "Código Penal Federal, art. 367",
                                List.of("Apoderamiento de una cosa ajena mueble", "Sin derecho", "Sin consentimiento de quien puede disponer de ella"),
                                "Según el valor de lo robado, hasta 10 años de prisión (art. 370)")),
                new OffenseEntry(anyOf("enganar*", "defraud*", "estaf*", "fraude*"),
                        new OffenseProfile("fraude", "Código Penal Federal, art. 386",
                                List.of("Engaño o aprovechamiento del error", "Obtención ilícita de una cosa o de un lucro indebido", "Perjuicio patrimonial"),
                                "Según el monto defraudado, hasta 12 años de prisión")),
                new OffenseEntry(anyOf("golpe*", "herir", "herida*", "hirio", "hirieron", "lastim*", "lesiones"),
                        new OffenseProfile("lesiones", "Código Penal Federal, art. 288",
                                List.of("Alteración en la salud o daño que deja huella material", "Causada por un tercero", "Dolo o culpa"),
                                "De 3 días a 2 años de prisión, agravada según las secuelas (arts. 289 a 293)")),
                new OffenseEntry(anyOf("calumni*", "difam*", "injuri*"),
                        new OffenseProfile("difamacion", "Código Civil Federal, art. 1916",
                                List.of("Imputación de un hecho que cause deshonra o descrédito", "Comunicación a terceros"),
                                "Tipo penal derogado en el ámbito federal; procede la reparación del daño moral por la vía civil")),
                new OffenseEntry(anyOf("abuso sexual", "agresion sexual", "violacion sexual", "la violo", "lo violo", "la violaron", "lo violaron"),
                        new OffenseProfile("violacion", "Código Penal Federal, art. 265",
                                List.of("Cópula", "Violencia física o moral", "Ausencia de consentimiento"),
                                "8 a 20 años de prisión")),
                new OffenseEntry(anyOf("amenaz*", "intimid*"),
                        new OffenseProfile("amenazas", "Código Penal Federal, art. 282",
                                List.of("Intimidación con causar un mal", "En la persona, bienes, honor o derechos del amenazado o de alguien ligado a él"),
                                "3 días a 1 año de prisión o multa"))
        );
    }

    private static Map<LegalArea, KeywordPredicate> areas0() {
        Map<LegalArea, KeywordPredicate> m = new LinkedHashMap<>();
        m.put(LegalArea.CONSTITUCIONAL, anyOf("constitucion*", "derechos fundamentales", "amparo", "garantias"));
        m.put(LegalArea.CIVIL, anyOf("contrato*", "propiedad", "obligaciones", "responsabilidad civil"));
        m.put(LegalArea.PENAL, anyOf("delito*", "crimen", "penal", "criminal"));
        m.put(LegalArea.LABORAL, anyOf("trabajo", "empleado*", "salario*", "despido"));
        m.put(LegalArea.MERCANTIL, anyOf("comercio", "empresa*", "mercantil", "sociedad"));
        m.put(LegalArea.ADMINISTRATIVO, anyOf("autoridad*", "funcionari*", "administrativo", "gobierno"));
        m.put(LegalArea.FISCAL, anyOf("impuesto*", "fiscal", "tributario", "hacienda"));
        m.put(LegalArea.FAMILIAR, anyOf("matrimonio", "divorcio", "patria potestad", "alimentos"));
        return m;
    }
}

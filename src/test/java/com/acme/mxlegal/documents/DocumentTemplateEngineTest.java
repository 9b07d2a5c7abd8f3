package com.acme.mxlegal.documents;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.content.TemplateSkeleton;
import com.acme.mxlegal.model.DocumentRequest;
import com.acme.mxlegal.model.Enums.DocumentType;
import com.acme.mxlegal.model.Enums.ErrorKind;
import com.acme.mxlegal.model.GeneratedDocument;
import com.acme.mxlegal.model.LegalError;
import com.acme.mxlegal.model.LegalException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DocumentTemplateEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final LegalContentLibrary library = LegalContentLibrary.standard();
    private final DocumentTemplateEngine engine = new DocumentTemplateEngine(library, Clock.fixed(NOW, ZoneOffset.UTC));

    static Map<String, Object> amparoFields() {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("quejoso_nombre", "Juan Pérez");
        f.put("quejoso_domicilio", "Calle Falsa 123, CDMX");
        f.put("autoridad_responsable", "Secretaría de Hacienda");
        f.put("acto_reclamado", "Negativa de devolución de impuestos");
        f.put("derecho_violado", "Derecho de petición");
        f.put("conceptos_violacion", List.of("Violación al artículo 8 constitucional"));
        f.put("fecha_acto", "2024-01-15");
        f.put("juzgado", "Primer Tribunal Colegiado");
        return f;
    }

    // One sample value per required field; list fields get two entries.
    private Map<String, Object> sampleFields(DocumentType type) {
        TemplateSkeleton skeleton = library.getTemplate(type);
        Map<String, Object> f = new LinkedHashMap<>();
        for (String name : skeleton.requiredFields()) {
            if (skeleton.listFields().contains(name)) f.put(name, List.of(name + " primero", name + " segundo"));
            else f.put(name, "Valor de " + name);
        }
        return f;
    }

    private LegalError renderExpectingError(DocumentRequest request) {
        LegalException e = catchThrowableOfType(() -> engine.render(request), LegalException.class);
        assertThat(e).isNotNull();
        return e.error();
    }

    @Test
    void render_shouldProduceAmparoWithCallerValues() {
        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.AMPARO, amparoFields()));

        assertThat(doc.documentType()).isEqualTo(DocumentType.AMPARO);
        assertThat(doc.generatedAt()).isEqualTo(NOW);
        assertThat(doc.renderedText())
                .contains("Juan Pérez", "Secretaría de Hacienda", "Violación al artículo 8 constitucional")
                .contains("1.- Violación al artículo 8 constitucional")
                .contains("Fecha del acto reclamado: 2024-01-15")
                .startsWith("JUICIO DE AMPARO INDIRECTO\nC. JUEZ Primer Tribunal Colegiado");
    }

    @Test
    void render_shouldKeepSkeletonSectionOrderAndUpperCaseTitles() {
        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.AMPARO, amparoFields()));

        assertThat(doc.sections()).extracting(GeneratedDocument.Section::title).containsExactly(
                "JUICIO DE AMPARO INDIRECTO", "", "AUTORIDAD RESPONSABLE", "ACTO RECLAMADO", "DERECHO VIOLADO",
                "CONCEPTOS DE VIOLACIÓN", "PUNTOS PETITORIOS", "PROTESTO LO NECESARIO");
    }

    @Test
    void render_shouldSeparateSectionsWithSingleBlankLine() {
        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.LAWSUIT, sampleFields(DocumentType.LAWSUIT)));

        assertThat(doc.renderedText()).doesNotContain("\n\n\n");
        assertThat(doc.renderedText().split("\n\n")).hasSize(doc.sections().size());
    }

    @Test
    void render_shouldDefaultPresentationDateToRenderDateInSpanish() {
        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.AMPARO, amparoFields()));

        assertThat(doc.renderedText()).contains("1 de marzo de 2024");
    }

    @ParameterizedTest
    @EnumSource(DocumentType.class)
    void render_shouldContainEverySuppliedValueVerbatim(DocumentType type) {
        Map<String, Object> fields = sampleFields(type);

        GeneratedDocument doc = engine.render(new DocumentRequest(type, fields));

        for (Object value : fields.values()) {
            if (value instanceof List<?> items) {
                for (Object item : items) assertThat(doc.renderedText()).contains(item.toString());
            } else {
                assertThat(doc.renderedText()).contains(value.toString());
            }
        }
    }

    @ParameterizedTest
    @EnumSource(DocumentType.class)
    void render_shouldReportEachOmittedRequiredField(DocumentType type) {
        for (String field : library.getRequiredFields(type)) {
            Map<String, Object> fields = sampleFields(type);
            fields.remove(field);

            LegalError error = renderExpectingError(new DocumentRequest(type, fields));

            assertThat(error.kind()).isEqualTo(ErrorKind.MISSING_REQUIRED_FIELD);
            assertThat(error.fields()).containsExactly(field);
        }
    }

    @Test
    void render_shouldReportAllMissingFieldsAtOnce() {
        Map<String, Object> fields = amparoFields();
        fields.remove("quejoso_nombre");
        fields.put("juzgado", "   ");
        fields.put("conceptos_violacion", List.of());

        LegalError error = renderExpectingError(new DocumentRequest(DocumentType.AMPARO, fields));

        assertThat(error.fields()).containsExactly("quejoso_nombre", "conceptos_violacion", "juzgado");
    }

    @Test
    void render_shouldListEveryContractFieldForEmptyRequest() {
        LegalError error = renderExpectingError(new DocumentRequest(DocumentType.CONTRACT, Map.of()));

        assertThat(error.kind()).isEqualTo(ErrorKind.MISSING_REQUIRED_FIELD);
        assertThat(error.fields()).containsExactly(
                "tipo_contrato", "parte_1_nombre", "parte_1_datos", "parte_2_nombre", "parte_2_datos", "objeto_contrato");
    }

    @Test
    void render_shouldBeByteIdenticalForSameInputAndClock() {
        DocumentRequest request = new DocumentRequest(DocumentType.AMPARO, amparoFields());

        String first = engine.render(request).renderedText();
        String second = new DocumentTemplateEngine(library, Clock.fixed(NOW, ZoneOffset.UTC)).render(request).renderedText();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void render_shouldNotExpandPlaceholdersOrSpecialCharactersInCallerText() {
        Map<String, Object> fields = amparoFields();
        fields.put("quejoso_nombre", "{{juzgado}} $1 \\ Pérez");

        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.AMPARO, fields));

        assertThat(doc.renderedText()).contains("{{juzgado}} $1 \\ Pérez");
    }

    @Test
    void render_shouldApplyContractDefaultsAndOmitEmptyConditions() {
        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.CONTRACT, sampleFields(DocumentType.CONTRACT)));

        assertThat(doc.renderedText())
                .contains("El precio será de A convenir.")
                .contains("duración de Por tiempo indefinido.")
                .doesNotContain("CUARTA.- CONDICIONES ESPECIALES");
        assertThat(doc.sections().get(0).title()).isEqualTo("CONTRATO DE VALOR DE TIPO_CONTRATO");
    }

    @Test
    void render_shouldEnumerateSpecialConditionsInInputOrder() {
        Map<String, Object> fields = sampleFields(DocumentType.CONTRACT);
        fields.put("condiciones_especiales", List.of("Sin mascotas", "Pago mensual anticipado"));
        fields.put("precio", "$12,000.00 MXN mensuales");

        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.CONTRACT, fields));

        assertThat(doc.renderedText())
                .contains("CUARTA.- CONDICIONES ESPECIALES\n1.- Sin mascotas\n2.- Pago mensual anticipado")
                .contains("El precio será de $12,000.00 MXN mensuales.");
    }

    @Test
    void render_shouldKeepBlankListEntriesInPlace() {
        Map<String, Object> fields = sampleFields(DocumentType.CONTRACT);
        fields.put("condiciones_especiales", List.of("Sin mascotas", "", "Pago anticipado"));

        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.CONTRACT, fields));

        assertThat(doc.renderedText()).contains("1.- Sin mascotas\n2.- \n3.- Pago anticipado");
    }

    @Test
    void render_shouldFormatStructuredHeirsAndKeepAuthoredHeadings() {
        Map<String, Object> heir = new LinkedHashMap<>();
        heir.put("nombre", "Ana López");
        heir.put("porcentaje", 50);
        heir.put("parentesco", "hija");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("testador", "María López");
        fields.put("herederos", List.of(heir, "Pedro López"));
        fields.put("bienes", List.of("Casa en Coyoacán"));

        GeneratedDocument doc = engine.render(new DocumentRequest(DocumentType.WILL, fields));

        assertThat(doc.renderedText())
                .contains("1.- Ana López - 50% - hija\n2.- Pedro López")
                .contains("SEGUNDA.- Institución de herederos");
    }

    @Test
    void render_shouldFailWithUnknownDocumentType_whenTypeMissing() {
        LegalError error = renderExpectingError(new DocumentRequest(null, amparoFields()));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN_DOCUMENT_TYPE);
    }
}

package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.model.AssessmentResult;
import com.acme.mxlegal.model.CaseFacts;
import com.acme.mxlegal.model.Enums.ErrorKind;
import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.Enums.RiskLevel;
import com.acme.mxlegal.model.Finding;
import com.acme.mxlegal.model.LegalException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class LegalRuleEvaluatorTest {

    private final LegalRuleEvaluator evaluator = new LegalRuleEvaluator(LegalContentLibrary.standard());

    @Test
    void evaluate_shouldFlagUnjustifiedDismissal() {
        CaseFacts facts = new CaseFacts(
                List.of("El empleado fue despedido sin causa justificada", "No se pagó finiquito"),
                "¿Procede demanda laboral por despido injustificado?",
                LegalArea.LABORAL);

        AssessmentResult result = evaluator.evaluate(facts);

        assertThat(result.area()).isEqualTo(LegalArea.LABORAL);
        assertThat(result.findings()).isNotEmpty();
        Finding dismissal = result.findings().get(0);
        assertThat(dismissal.citedProvisions()).contains("Ley Federal del Trabajo, art. 48");
        assertThat(dismissal.riskLevel()).isIn(RiskLevel.MEDIUM, RiskLevel.HIGH);
        assertThat(result.disclaimer()).isNotBlank();
    }

    @Test
    void evaluate_shouldCollectEveryMatchingRuleInTableOrder() {
        CaseFacts facts = new CaseFacts(
                List.of("Me despidieron", "No me pagaron el aguinaldo", "Sufrí acoso de mi jefe"),
                "¿Qué puedo reclamar?",
                LegalArea.LABORAL);

        AssessmentResult result = evaluator.evaluate(facts);

        assertThat(result.findings()).hasSize(3);
        assertThat(result.findings()).extracting(f -> f.citedProvisions().get(0)).containsExactly(
                "Constitución Política de los Estados Unidos Mexicanos, art. 123, apartado A, fracción XXII",
                "Ley Federal del Trabajo, art. 76",
                "Ley Federal del Trabajo, art. 3 Bis");
        assertThat(result.overallRisk()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void evaluate_shouldNotFlagDismissalWithJustifiedCause() {
        CaseFacts facts = new CaseFacts(List.of("Fue despedido con causa justificada por faltas"), "¿Puedo demandar?", LegalArea.LABORAL);

        AssessmentResult result = evaluator.evaluate(facts);

        assertThat(result.findings()).flatExtracting(Finding::citedProvisions)
                .doesNotContain("Ley Federal del Trabajo, art. 48");
    }

    @Test
    void evaluate_shouldMatchIgnoringCaseAndAccents() {
        CaseFacts facts = new CaseFacts(List.of("EL PATRÓN LO DESPIDIÓ"), "", LegalArea.LABORAL);

        assertThat(evaluator.evaluate(facts).findings().get(0).citedProvisions())
                .contains("Ley Federal del Trabajo, art. 47");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "PENAL    | El juez comprobó que el acusado estaba en otra ciudad",
            "PENAL    | Actuó con violación de mis derechos procesales",
            "FAMILIAR | Me pidió guardar silencio"
    })
    void evaluate_shouldIgnoreKeywordsInsideOtherWords(LegalArea area, String fact) {
        AssessmentResult result = evaluator.evaluate(new CaseFacts(List.of(fact), "", area));

        assertThat(result.findings()).hasSize(1);
        assertThat(result.overallRisk()).isEqualTo(RiskLevel.LOW);
        assertThat(result.findings().get(0).conclusion()).startsWith("No se identificaron patrones suficientes");
    }

    @Test
    void evaluate_shouldStillMatchInflectedOffenseVerbs() {
        AssessmentResult result = evaluator.evaluate(new CaseFacts(List.of("Le robaron el auto y lo golpearon"), "", LegalArea.PENAL));

        assertThat(result.findings()).extracting(Finding::conclusion).containsExactly(
                "Los hechos podrían configurar el delito de robo.",
                "Los hechos podrían configurar el delito de lesiones.");
    }

    @Test
    void evaluate_shouldReturnGenericLowRiskFinding_whenNothingMatches() {
        AssessmentResult result = evaluator.evaluate(new CaseFacts(List.of("El cielo es azul"), "¿?", LegalArea.CIVIL));

        assertThat(result.findings()).hasSize(1);
        Finding generic = result.findings().get(0);
        assertThat(generic.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(generic.citedProvisions()).isEmpty();
        assertThat(generic.conclusion()).contains("No se identificaron patrones suficientes");
        assertThat(generic.recommendedActions()).isNotEmpty();
        assertThat(result.overallRisk()).isEqualTo(RiskLevel.LOW);
        assertThat(result.disclaimer()).isEqualTo(LegalContentLibrary.DISCLAIMER);
    }

    @Test
    void evaluate_shouldFailWithEmptyFactSet_whenOnlyBlankFacts() {
        LegalException e = catchThrowableOfType(
                () -> evaluator.evaluate(new CaseFacts(List.of("  ", ""), "¿?", LegalArea.CIVIL)), LegalException.class);

        assertThat(e.error().kind()).isEqualTo(ErrorKind.EMPTY_FACT_SET);
    }

    @Test
    void evaluate_shouldFailWithUnknownArea_whenAreaMissing() {
        LegalException e = catchThrowableOfType(
                () -> evaluator.evaluate(new CaseFacts(List.of("hecho"), "¿?", null)), LegalException.class);

        assertThat(e.error().kind()).isEqualTo(ErrorKind.UNKNOWN_AREA);
    }

    @ParameterizedTest
    @EnumSource(LegalArea.class)
    void evaluate_shouldAlwaysAttachDisclaimer(LegalArea area) {
        AssessmentResult result = evaluator.evaluate(new CaseFacts(List.of("Un hecho cualquiera"), "¿Qué procede?", area));

        assertThat(result.disclaimer()).isNotBlank();
        assertThat(result.findings()).isNotEmpty();
    }
}

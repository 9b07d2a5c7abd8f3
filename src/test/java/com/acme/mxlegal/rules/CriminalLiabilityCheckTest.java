package com.acme.mxlegal.rules;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.model.CriminalLiabilityResult;
import com.acme.mxlegal.model.CriminalLiabilityResult.OffenseProfile;
import com.acme.mxlegal.model.Enums.ErrorKind;
import com.acme.mxlegal.model.LegalException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class CriminalLiabilityCheckTest {

    private final CriminalLiabilityCheck check = new CriminalLiabilityCheck(LegalContentLibrary.standard());

    @Test
    void run_shouldIdentifyOffensesInCatalogOrder() {
        CriminalLiabilityResult result = check.run(List.of("Lo golpearon en la calle", "Le robaron la cartera"));

        assertThat(result.possibleOffenses()).extracting(OffenseProfile::offense).containsExactly("robo", "lesiones");
        assertThat(result.possibleOffenses().get(0).article()).isEqualTo("Código Penal Federal, art. 367");
        assertThat(result.possibleOffenses().get(0).elements()).isNotEmpty();
        assertThat(result.possibleDefenses()).isNotEmpty();
        assertThat(result.proceduralRecommendation()).contains("abogado penalista");
        assertThat(result.disclaimer()).isNotBlank();
    }

    @Test
    void run_shouldReportNoOffense_whenNothingMatches() {
        CriminalLiabilityResult result = check.run(List.of("Compré un libro"));

        assertThat(result.possibleOffenses()).isEmpty();
        assertThat(result.possibleDefenses()).isEmpty();
        assertThat(result.proceduralRecommendation()).isEqualTo("No se identifican elementos que configuren delito.");
    }

    @Test
    void run_shouldNotReadOffensesIntoUnrelatedWords() {
        CriminalLiabilityResult result = check.run(List.of("Se comprobó la violación de mis derechos procesales"));

        assertThat(result.possibleOffenses()).isEmpty();
    }

    @Test
    void run_shouldFailWithEmptyFactSet() {
        LegalException e = catchThrowableOfType(() -> check.run(List.of()), LegalException.class);

        assertThat(e.error().kind()).isEqualTo(ErrorKind.EMPTY_FACT_SET);
    }
}

package com.acme.mxlegal.content;

import com.acme.mxlegal.util.TextUtil;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordPredicateTest {

    @Test
    void test_shouldMatchAnyKeywordIgnoringCaseAndAccents() {
        KeywordPredicate p = KeywordPredicate.anyOf("despidió", "finiquito");

        assertThat(p.test(TextUtil.fold("El patrón lo DESPIDIO ayer"))).isTrue();
        assertThat(p.test(TextUtil.fold("Sin pago de FINIQUITO"))).isTrue();
        assertThat(p.test(TextUtil.fold("Renunció a su empleo"))).isFalse();
    }

    @Test
    void unless_shouldSuppressMatchWhenExcludedKeywordPresent() {
        KeywordPredicate p = KeywordPredicate.anyOf("despedido").unless("con causa justificada");

        assertThat(p.test(TextUtil.fold("Fue despedido sin causa justificada"))).isTrue();
        assertThat(p.test(TextUtil.fold("Fue despedido con causa justificada"))).isFalse();
    }

    @Test
    void and_shouldRequireEveryKeyword() {
        KeywordPredicate p = KeywordPredicate.anyOf("contrato").and("firma", "testigos");

        assertThat(p.test(TextUtil.fold("contrato con firma y testigos"))).isTrue();
        assertThat(p.test(TextUtil.fold("contrato con firma"))).isFalse();
    }

    @Test
    void test_shouldMatchWholeWordsOnly() {
        KeywordPredicate p = KeywordPredicate.anyOf("robo", "guarda");

        assertThat(p.test(TextUtil.fold("Sufrió un robo en su casa"))).isTrue();
        assertThat(p.test(TextUtil.fold("El juez comprobó la coartada"))).isFalse();
        assertThat(p.test(TextUtil.fold("Me pidió guardar silencio"))).isFalse();
    }

    @Test
    void test_shouldTreatTrailingStarAsStem() {
        KeywordPredicate p = KeywordPredicate.anyOf("golpe*", "discrimin*");

        assertThat(p.test(TextUtil.fold("Lo golpearon"))).isTrue();
        assertThat(p.test(TextUtil.fold("Trato discriminatorio"))).isTrue();
        assertThat(p.test(TextUtil.fold("Recibió un antigolpe"))).isFalse();
    }

    @Test
    void anyOf_shouldRejectBlankKeyword() {
        assertThatThrownBy(() -> KeywordPredicate.anyOf("*")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void anyOf_shouldRejectEmptyKeywordSet() {
        assertThatThrownBy(() -> KeywordPredicate.anyOf()).isInstanceOf(IllegalArgumentException.class);
    }
}

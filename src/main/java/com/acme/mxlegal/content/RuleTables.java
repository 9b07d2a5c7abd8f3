package com.acme.mxlegal.content;

import com.acme.mxlegal.model.Enums.LegalArea;
import com.acme.mxlegal.model.Finding;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.acme.mxlegal.content.KeywordPredicate.anyOf;

final class RuleTables {

    private RuleTables() {}

    private static final String CPEUM = "Constitución Política de los Estados Unidos Mexicanos, art. ";
    private static final String AMPARO = "Ley de Amparo, art. ";
    private static final String CCF = "Código Civil Federal, art. ";
    private static final String CPF = "Código Penal Federal, art. ";
    private static final String CNPP = "Código Nacional de Procedimientos Penales, art. ";
    private static final String LFT = "Ley Federal del Trabajo, art. ";
    private static final String CCOM = "Código de Comercio, art. ";
    private static final String LGTOC = "Ley General de Títulos y Operaciones de Crédito, art. ";
    private static final String LGSM = "Ley General de Sociedades Mercantiles, art. ";
    private static final String LCM = "Ley de Concursos Mercantiles, art. ";
    private static final String LFPA = "Ley Federal de Procedimiento Administrativo, art. ";
    private static final String LFPCA = "Ley Federal de Procedimiento Contencioso Administrativo, art. ";
    private static final String LGRA = "Ley General de Responsabilidades Administrativas, art. ";
    private static final String LAASSP = "Ley de Adquisiciones, Arrendamientos y Servicios del Sector Público, art. ";
    private static final String CFF = "Código Fiscal de la Federación, art. ";

    static Map<LegalArea, RuleTable> all() {
        Map<LegalArea, RuleTable> m = new EnumMap<>(LegalArea.class);
        m.put(LegalArea.CONSTITUCIONAL, constitucional());
        m.put(LegalArea.CIVIL, civil());
        m.put(LegalArea.PENAL, penal());
        m.put(LegalArea.LABORAL, laboral());
        m.put(LegalArea.MERCANTIL, mercantil());
        m.put(LegalArea.ADMINISTRATIVO, administrativo());
        m.put(LegalArea.FISCAL, fiscal());
        m.put(LegalArea.FAMILIAR, familiar());
        return m;
    }

    static RuleTable constitucional() {
        return new RuleTable(LegalArea.CONSTITUCIONAL, List.of(
                new Rule("debido-proceso",
                        anyOf("sin juicio", "sin audiencia", "debido proceso", "sin ser oido", "sin notificacion", "sin notificar", "sin previo aviso"),
                        Finding.high("Posible privación de derechos sin juicio previo ni garantía de audiencia.",
                                List.of(CPEUM + "14", AMPARO + "107", AMPARO + "17"),
                                List.of("Promover juicio de amparo indirecto dentro de los 15 días hábiles siguientes a la notificación o conocimiento del acto",
                                        "Solicitar la suspensión del acto reclamado",
                                        "Reunir constancias del procedimiento seguido por la autoridad"))),
                new Rule("legalidad",
                        anyOf("sin fundamento", "sin motivacion", "sin orden", "orden escrita", "cateo", "detencion arbitraria", "detenido sin"),
                        Finding.high("El acto de molestia podría carecer de mandamiento escrito fundado y motivado.",
                                List.of(CPEUM + "16", AMPARO + "107"),
                                List.of("Verificar si existe mandamiento escrito de autoridad competente",
                                        "Promover juicio de amparo indirecto contra el acto de molestia"))),
                new Rule("peticion",
                        anyOf("peticion", "sin respuesta", "no ha respondido", "no contesto", "no respondio", "devolucion"),
                        Finding.medium("Posible violación al derecho de petición por falta de respuesta en breve término.",
                                List.of(CPEUM + "8", AMPARO + "107"),
                                List.of("Acreditar la fecha de presentación de la petición con acuse de recibo",
                                        "Promover amparo por omisión de respuesta"))),
                new Rule("igualdad",
                        anyOf("discrimin*", "igualdad", "trato desigual"),
                        Finding.medium("Los hechos sugieren un trato discriminatorio contrario al principio de igualdad.",
                                List.of(CPEUM + "1", "Ley Federal para Prevenir y Eliminar la Discriminación, art. 1"),
                                List.of("Documentar el trato diferenciado y su motivo",
                                        "Valorar queja ante el CONAPRED o promoción de amparo"))),
                new Rule("expresion",
                        anyOf("censura", "libertad de expresion", "libertad de imprenta"),
                        Finding.medium("Posible restricción indebida a la libertad de expresión.",
                                List.of(CPEUM + "6", CPEUM + "7"),
                                List.of("Identificar la autoridad que impuso la restricción",
                                        "Evaluar la procedencia de amparo indirecto")))
        ));
    }

    static RuleTable civil() {
        return new RuleTable(LegalArea.CIVIL, List.of(
                new Rule("incumplimiento-contractual",
                        anyOf("incumplimiento", "incumplio", "no cumplio", "no ha cumplido", "adeudo", "no pago"),
                        Finding.medium("Existe un posible incumplimiento de obligaciones que permite exigir el cumplimiento o la rescisión, más daños y perjuicios.",
                                List.of(CCF + "1949", CCF + "2104", CCF + "2108"),
                                List.of("Requerir el cumplimiento por escrito y conservar acuse",
                                        "Cuantificar daños y perjuicios",
                                        "Evaluar la posibilidad de una solución extrajudicial"))),
                new Rule("responsabilidad-extracontractual",
                        anyOf("dano material", "dano moral", "danos y perjuicios", "causo danos", "accidente", "choque"),
                        Finding.medium("Los hechos podrían generar responsabilidad civil por hecho ilícito.",
                                List.of(CCF + "1910", CCF + "1915"),
                                List.of("Reunir pruebas del daño y del nexo causal",
                                        "Obtener avalúo o cotización de la reparación"))),
                new Rule("arrendamiento",
                        anyOf("arrendamiento", "arrendador", "arrendatario", "inquilino", "la renta", "las rentas"),
                        Finding.medium("La controversia se rige por las reglas del contrato de arrendamiento.",
                                List.of(CCF + "2398", CCF + "2425", CCF + "2489"),
                                List.of("Revisar el contrato de arrendamiento y los recibos de pago",
                                        "Valorar juicio especial de arrendamiento inmobiliario"))),
                new Rule("vicios-consentimiento",
                        anyOf("sin consentimiento", "vicio del consentimiento", "bajo amenaza", "coaccion", "engano", "lesion"),
                        Finding.high("El acto jurídico podría estar afectado de nulidad por vicios del consentimiento.",
                                List.of(CCF + "1794", CCF + "1795", CCF + "1812", CCF + "1819"),
                                List.of("Ejercer la acción de nulidad relativa dentro del plazo legal",
                                        "Reunir pruebas del error, dolo o violencia"))),
                new Rule("prescripcion",
                        anyOf("prescripcion", "prescrito", "hace mas de diez anos"),
                        Finding.high("La acción podría estar prescrita; el plazo general es de diez años.",
                                List.of(CCF + "1135", CCF + "1159"),
                                List.of("Determinar la fecha en que la obligación fue exigible",
                                        "Identificar actos que hayan interrumpido la prescripción")))
        ));
    }

    static RuleTable penal() {
        return new RuleTable(LegalArea.PENAL, List.of(
                new Rule("homicidio",
                        anyOf("matar", "mataron", "mato", "muerte", "asesin*", "privo de la vida", "homicidio"),
                        Finding.high("Los hechos podrían configurar el delito de homicidio.",
                                List.of(CPF + "302", CPF + "307"),
                                List.of("Contactar de inmediato a un abogado penalista", "Denunciar ante el Ministerio Público"))),
                new Rule("robo",
                        anyOf("robar*", "robo", "robos", "robado*", "sustraer", "sustrajo", "sustrajeron", "hurt*", "apodero"),
                        Finding.high("Los hechos podrían configurar el delito de robo.",
                                List.of(CPF + "367", CPF + "370"),
                                List.of("Presentar denuncia ante el Ministerio Público", "Acreditar la propiedad y el valor de lo sustraído"))),
                new Rule("fraude",
                        anyOf("enganar*", "defraud*", "estaf*", "fraude*"),
                        Finding.high("Los hechos podrían configurar el delito de fraude.",
                                List.of(CPF + "386"),
                                List.of("Conservar comunicaciones y comprobantes de pago", "Presentar denuncia o querella"))),
                new Rule("lesiones",
                        anyOf("golpe*", "herir", "herida*", "hirio", "hirieron", "lastim*", "lesiones"),
                        Finding.medium("Los hechos podrían configurar el delito de lesiones.",
                                List.of(CPF + "288", CPF + "289"),
                                List.of("Obtener certificado médico de lesiones", "Presentar denuncia ante el Ministerio Público"))),
                new Rule("delitos-sexuales",
                        anyOf("abuso sexual", "agresion sexual", "violacion sexual", "la violo", "lo violo", "la violaron", "lo violaron"),
                        Finding.high("Los hechos podrían configurar un delito contra la libertad sexual.",
                                List.of(CPF + "260", CPF + "265"),
                                List.of("Acudir a la fiscalía especializada", "Solicitar medidas de protección para la víctima"))),
                new Rule("amenazas",
                        anyOf("amenaz*", "intimid*"),
                        Finding.medium("Los hechos podrían configurar el delito de amenazas.",
                                List.of(CPF + "282"),
                                List.of("Documentar las amenazas recibidas", "Solicitar medidas de protección"))),
                new Rule("detencion",
                        anyOf("detenido", "detenida", "detencion", "arrestado", "arrestada", "vinculacion a proceso"),
                        Finding.high("Existe una persona privada de la libertad; deben vigilarse los plazos constitucionales.",
                                List.of(CPEUM + "16", CPEUM + "19", CNPP + "113"),
                                List.of("Nombrar defensor de inmediato", "Verificar la legalidad de la detención ante el juez de control")))
        ));
    }

    static RuleTable laboral() {
        return new RuleTable(LegalArea.LABORAL, List.of(
                new Rule("despido-injustificado",
                        anyOf("despedido", "despedida", "despido", "despidieron", "despidio", "separado de su empleo")
                                .unless("con causa justificada", "renuncia voluntaria"),
                        Finding.high("Los hechos sugieren un despido injustificado: procede reclamar la reinstalación o la indemnización constitucional.",
                                List.of(CPEUM + "123, apartado A, fracción XXII", LFT + "47", LFT + "48", LFT + "50"),
                                List.of("Acudir a la conciliación prejudicial ante el Centro de Conciliación competente",
                                        "Presentar la demanda antes de que transcurran dos meses desde el despido",
                                        "Reclamar indemnización de tres meses de salario y salarios vencidos"))),
                new Rule("prestaciones-devengadas",
                        anyOf("finiquito", "liquidacion", "aguinaldo", "vacaciones", "prima vacacional", "prima de antiguedad", "salario*"),
                        Finding.medium("Existen prestaciones devengadas que el patrón debe cubrir.",
                                List.of(LFT + "76", LFT + "80", LFT + "87", LFT + "162"),
                                List.of("Calcular aguinaldo, vacaciones y prima vacacional proporcionales",
                                        "Reclamar las prestaciones antes de que prescriban en un año"))),
                new Rule("hostigamiento",
                        anyOf("acoso", "hostigamiento"),
                        Finding.high("Los hechos podrían constituir hostigamiento o acoso en el trabajo.",
                                List.of(LFT + "3 Bis", LFT + "51", LFT + "133"),
                                List.of("Documentar los hechos y posibles testigos",
                                        "Valorar la rescisión de la relación laboral sin responsabilidad para el trabajador"))),
                new Rule("jornada",
                        anyOf("horas extra*", "tiempo extraordinario", "jornada*"),
                        Finding.medium("Posible reclamo por jornada excesiva o tiempo extraordinario no pagado.",
                                List.of(LFT + "61", LFT + "66", LFT + "67", LFT + "68"),
                                List.of("Reunir controles de asistencia y recibos de nómina"))),
                new Rule("riesgo-de-trabajo",
                        anyOf("accidente de trabajo", "riesgo de trabajo", "enfermedad profesional"),
                        Finding.high("Los hechos podrían constituir un riesgo de trabajo con derecho a prestaciones.",
                                List.of(LFT + "473", LFT + "474", LFT + "487"),
                                List.of("Dar aviso al IMSS y solicitar la calificación del riesgo", "Conservar el expediente médico")))
        ));
    }

    static RuleTable mercantil() {
        return new RuleTable(LegalArea.MERCANTIL, List.of(
                new Rule("titulos-de-credito",
                        anyOf("pagare*", "cheque*", "letra de cambio", "titulo de credito", "titulos de credito"),
                        Finding.medium("El cobro puede intentarse en la vía ejecutiva mercantil con base en el título de crédito.",
                                List.of(LGTOC + "5", LGTOC + "150", LGTOC + "170", CCOM + "1391"),
                                List.of("Conservar el título original", "Verificar que la acción cambiaria no haya prescrito (tres años)"))),
                new Rule("sociedades",
                        anyOf("sociedad", "socio", "socios", "accionista*", "asamblea*"),
                        Finding.medium("La controversia involucra derechos corporativos regidos por la ley de sociedades.",
                                List.of(LGSM + "178", LGSM + "200", LGSM + "201"),
                                List.of("Revisar estatutos sociales y actas de asamblea"))),
                new Rule("compraventa-mercantil",
                        anyOf("mercancia*", "compraventa mercantil", "proveedor*", "factura", "facturas"),
                        Finding.medium("Operación mercantil sujeta a las reglas de la compraventa comercial.",
                                List.of(CCOM + "75", CCOM + "371", CCOM + "376"),
                                List.of("Reunir órdenes de compra, facturas y constancias de entrega"))),
                new Rule("insolvencia",
                        anyOf("insolvencia", "concurso mercantil", "quiebra"),
                        Finding.high("Los hechos sugieren un supuesto de concurso mercantil.",
                                List.of(LCM + "9", LCM + "10", LCM + "20"),
                                List.of("Evaluar la solicitud o demanda de concurso mercantil", "Identificar y graduar créditos")))
        ));
    }

    static RuleTable administrativo() {
        return new RuleTable(LegalArea.ADMINISTRATIVO, List.of(
                new Rule("sancion-administrativa",
                        anyOf("multa*", "sancion*", "infraccion*", "clausura*"),
                        Finding.medium("La sanción administrativa puede impugnarse mediante recurso de revisión o juicio contencioso.",
                                List.of(LFPA + "70", LFPA + "73", LFPA + "83", LFPCA + "2"),
                                List.of("Interponer recurso de revisión dentro de 15 días", "Valorar juicio de nulidad ante el Tribunal Federal de Justicia Administrativa"))),
                new Rule("silencio-administrativo",
                        anyOf("sin respuesta", "silencio", "negativa ficta", "no respondio"),
                        Finding.medium("La falta de respuesta en tres meses puede configurar negativa ficta.",
                                List.of(LFPA + "17"),
                                List.of("Solicitar constancia de la falta de resolución", "Impugnar la negativa ficta"))),
                new Rule("contratacion-publica",
                        anyOf("licitacion", "adjudicacion", "contrato publico"),
                        Finding.medium("Controversia en materia de contratación pública.",
                                List.of(LAASSP + "26", LAASSP + "65"),
                                List.of("Presentar inconformidad dentro del plazo legal"))),
                new Rule("responsabilidad-servidores",
                        anyOf("servidor publico", "servidores publicos", "funcionari*", "soborno", "cohecho"),
                        Finding.high("Los hechos podrían implicar responsabilidad administrativa de servidores públicos.",
                                List.of(LGRA + "7", LGRA + "49", LGRA + "52"),
                                List.of("Presentar denuncia ante el órgano interno de control")))
        ));
    }

    static RuleTable fiscal() {
        return new RuleTable(LegalArea.FISCAL, List.of(
                new Rule("devolucion",
                        anyOf("devolucion", "saldo a favor"),
                        Finding.medium("Procede solicitar o impugnar la devolución de saldos a favor.",
                                List.of(CFF + "22"),
                                List.of("Verificar que la solicitud se resolvió en el plazo de 40 días", "Impugnar la negativa de devolución"))),
                new Rule("credito-fiscal",
                        anyOf("credito fiscal", "embargo", "requerimiento de pago", "determinacion de impuestos"),
                        Finding.high("Existe un crédito fiscal exigible que puede ejecutarse mediante procedimiento administrativo de ejecución.",
                                List.of(CFF + "117", CFF + "121", CFF + "145", LFPCA + "13"),
                                List.of("Interponer recurso de revocación dentro de 30 días hábiles", "Garantizar el interés fiscal para suspender la ejecución"))),
                new Rule("facultades-comprobacion",
                        anyOf("auditoria", "visita domiciliaria", "revision de gabinete"),
                        Finding.medium("La autoridad ejerce facultades de comprobación sujetas a plazos legales.",
                                List.of(CFF + "42", CFF + "46-A"),
                                List.of("Controlar el plazo de doce meses de la revisión", "Preparar la documentación contable solicitada"))),
                new Rule("operaciones-simuladas",
                        anyOf("factura apocrifa", "operaciones simuladas", "operaciones inexistentes", "69-b"),
                        Finding.high("Riesgo de presunción de operaciones inexistentes.",
                                List.of(CFF + "69-B"),
                                List.of("Aportar pruebas de la materialidad de las operaciones")))
        ));
    }

    static RuleTable familiar() {
        return new RuleTable(LegalArea.FAMILIAR, List.of(
                new Rule("divorcio",
                        anyOf("divorcio", "separacion"),
                        Finding.medium("Procede el divorcio sin expresión de causa con propuesta de convenio.",
                                List.of(CCF + "266", CCF + "267"),
                                List.of("Preparar propuesta de convenio sobre guarda, alimentos y bienes"))),
                new Rule("alimentos",
                        anyOf("pension alimenticia", "alimentos", "manutencion"),
                        Finding.high("Existe una obligación alimentaria exigible.",
                                List.of(CCF + "301", CCF + "303", CCF + "308", CCF + "311"),
                                List.of("Solicitar pensión alimenticia provisional", "Acreditar ingresos del deudor alimentario"))),
                new Rule("patria-potestad",
                        anyOf("custodia", "patria potestad", "guarda y custodia", "convivencia"),
                        Finding.high("La controversia afecta la patria potestad o la guarda y custodia de menores.",
                                List.of(CCF + "411", CCF + "414", CCF + "444"),
                                List.of("Priorizar el interés superior de la niñez en la estrategia", "Solicitar régimen de convivencia provisional"))),
                new Rule("violencia-familiar",
                        anyOf("violencia familiar", "violencia domestica", "maltrato"),
                        Finding.high("Los hechos podrían constituir violencia familiar.",
                                List.of(CCF + "323 Ter", CPF + "343 Bis"),
                                List.of("Solicitar órdenes de protección", "Presentar denuncia ante el Ministerio Público")))
        ));
    }
}

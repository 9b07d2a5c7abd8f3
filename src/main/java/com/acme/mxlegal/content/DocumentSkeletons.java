package com.acme.mxlegal.content;

import com.acme.mxlegal.content.TemplateSkeleton.HeadingStyle;
import com.acme.mxlegal.model.Enums.DocumentType;

import java.util.EnumMap;
import java.util.Map;

final class DocumentSkeletons {

    private DocumentSkeletons() {}

    private static final String SIGNATURE_LINE = "_____________________________";

    static Map<DocumentType, TemplateSkeleton> all() {
        Map<DocumentType, TemplateSkeleton> m = new EnumMap<>(DocumentType.class);
        m.put(DocumentType.AMPARO, amparo());
        m.put(DocumentType.CONTRACT, contract());
        m.put(DocumentType.LAWSUIT, lawsuit());
        m.put(DocumentType.POWER_OF_ATTORNEY, powerOfAttorney());
        m.put(DocumentType.WILL, will());
        return m;
    }

    static TemplateSkeleton amparo() {
        return TemplateSkeleton.builder(DocumentType.AMPARO)
                .required("quejoso_nombre", "quejoso_domicilio", "autoridad_responsable", "acto_reclamado",
                        "derecho_violado", "conceptos_violacion", "fecha_acto", "juzgado")
                .lists("conceptos_violacion")
                .dateDefault("fecha_presentacion")
                .section("Juicio de amparo indirecto", """
                        C. JUEZ {{juzgado}}
                        P R E S E N T E""")
                .section("", """
                        {{quejoso_nombre}}, por mi propio derecho, con domicilio para oír y recibir notificaciones en {{quejoso_domicilio}}, ante Usted comparezco y expongo:
                        Que por medio del presente escrito, con fundamento en los artículos 103, fracción I, y 107 de la Constitución Política de los Estados Unidos Mexicanos, así como 1°, fracción I, 107 y 108 de la Ley de Amparo, vengo a promover JUICIO DE AMPARO INDIRECTO, para lo cual manifiesto bajo protesta de decir verdad lo siguiente.""")
                .section("Autoridad responsable", "{{autoridad_responsable}}")
                .section("Acto reclamado", """
                        {{acto_reclamado}}
                        Fecha del acto reclamado: {{fecha_acto}}""")
                .section("Derecho violado", "{{derecho_violado}}")
                .section("Conceptos de violación", "{{#conceptos_violacion}}")
                .section("Puntos petitorios", """
                        Por lo anterior, a Usted C. Juez, atentamente solicito:
                        PRIMERO.- Se admita la presente demanda de amparo.
                        SEGUNDO.- Se conceda la suspensión del acto reclamado.
                        TERCERO.- Se otorgue el amparo y protección de la Justicia Federal.""")
                .section("Protesto lo necesario", """
                        {{fecha_presentacion}}
                        %s
                        {{quejoso_nombre}}
                        QUEJOSO""".formatted(SIGNATURE_LINE))
                .build();
    }

    static TemplateSkeleton contract() {
        return TemplateSkeleton.builder(DocumentType.CONTRACT)
                .required("tipo_contrato", "parte_1_nombre", "parte_1_datos", "parte_2_nombre", "parte_2_datos", "objeto_contrato")
                .lists("condiciones_especiales")
                .textDefault("precio", "A convenir")
                .textDefault("plazo", "Por tiempo indefinido")
                .dateDefault("fecha_firma")
                .section("Contrato de {{tipo_contrato}}", """
                        En la Ciudad de México, a {{fecha_firma}}, comparecen las partes que se indican para celebrar el presente contrato de {{tipo_contrato}}, al tenor de las siguientes declaraciones y cláusulas.""")
                .section("Partes", """
                        PRIMERA PARTE: {{parte_1_nombre}}
                        {{parte_1_datos}}
                        SEGUNDA PARTE: {{parte_2_nombre}}
                        {{parte_2_datos}}""")
                .section("Declaraciones", """
                        Ambas partes declaran que tienen capacidad legal para contratar y obligarse, y que en la celebración de este contrato no existe error, dolo, mala fe ni lesión que pudiera invalidarlo, en términos de los artículos 1794, 1795 y 1812 del Código Civil Federal.""")
                .section("Cláusulas", "Las partes convienen en sujetarse a las siguientes cláusulas.")
                .section("Primera.- Objeto del contrato", "{{objeto_contrato}}")
                .section("Segunda.- Precio", "El precio será de {{precio}}.")
                .section("Tercera.- Plazo", "El presente contrato tendrá una duración de {{plazo}}.")
                .sectionIf("condiciones_especiales", "Cuarta.- Condiciones especiales", "{{#condiciones_especiales}}")
                .section("Quinta.- Jurisdicción", """
                        Para la interpretación y cumplimiento de este contrato, las partes se someten a la jurisdicción de los tribunales de la Ciudad de México, renunciando a cualquier otro fuero que pudiera corresponderles por razón de su domicilio presente o futuro.""")
                .section("Firmas", """
                        En fe de lo cual, firman las partes en la fecha señalada.
                        %1$s
                        {{parte_1_nombre}}
                        %1$s
                        {{parte_2_nombre}}""".formatted(SIGNATURE_LINE))
                .build();
    }

    static TemplateSkeleton lawsuit() {
        return TemplateSkeleton.builder(DocumentType.LAWSUIT)
                .required("demandante_nombre", "demandante_domicilio", "demandado_nombre", "demandado_domicilio",
                        "prestaciones", "hechos", "fundamentos_derecho", "juzgado")
                .lists("prestaciones", "hechos", "fundamentos_derecho")
                .dateDefault("fecha_presentacion")
                .section("Escrito inicial de demanda", """
                        C. JUEZ {{juzgado}}
                        P R E S E N T E""")
                .section("", """
                        {{demandante_nombre}}, por mi propio derecho, con domicilio en {{demandante_domicilio}}, ante Usted comparezco y expongo:
                        Que por medio del presente escrito vengo a demandar de {{demandado_nombre}}, con domicilio en {{demandado_domicilio}}, las prestaciones que a continuación se indican, con base en los hechos y fundamentos de derecho siguientes.""")
                .section("Prestaciones", "{{#prestaciones}}")
                .section("Hechos", "{{#hechos}}")
                .section("Fundamentos de derecho", "{{#fundamentos_derecho}}")
                .section("Puntos petitorios", """
                        Por lo anterior, a Usted C. Juez, atentamente solicito se sirva:
                        PRIMERO.- Tener por presentada la demanda y admitirla a trámite.
                        SEGUNDO.- Ordenar el emplazamiento del demandado en el domicilio señalado.
                        TERCERO.- Declarar procedente la demanda y condenar al demandado al cumplimiento de las prestaciones reclamadas.""")
                .section("Protesto lo necesario", """
                        {{fecha_presentacion}}
                        %s
                        {{demandante_nombre}}
                        DEMANDANTE""".formatted(SIGNATURE_LINE))
                .build();
    }

    static TemplateSkeleton powerOfAttorney() {
        return TemplateSkeleton.builder(DocumentType.POWER_OF_ATTORNEY)
                .required("poderdante", "apoderado", "facultades")
                .lists("facultades")
                .dateDefault("fecha_otorgamiento")
                .section("Poder notarial", """
                        Por medio del presente documento, yo {{poderdante}}, otorgo poder amplio y suficiente a {{apoderado}} para que en mi nombre y representación realice los actos que se enumeran a continuación.""")
                .section("Facultades", "{{#facultades}}")
                .section("Alcance", """
                        Este poder se otorga con las facultades necesarias para su debido cumplimiento, en los términos del artículo 2554 del Código Civil Federal y sus correlativos de los códigos civiles de las entidades federativas.""")
                .section("Firmas", """
                        {{fecha_otorgamiento}}
                        %1$s
                        {{poderdante}}
                        PODERDANTE
                        %1$s
                        {{apoderado}}
                        APODERADO""".formatted(SIGNATURE_LINE))
                .build();
    }

    // Headings are authored in their final casing.
    static TemplateSkeleton will() {
        return TemplateSkeleton.builder(DocumentType.WILL)
                .headingStyle(HeadingStyle.AS_IS)
                .required("testador", "herederos", "bienes")
                .lists("herederos", "bienes")
                .dateDefault("fecha_otorgamiento")
                .section("TESTAMENTO", """
                        Yo, {{testador}}, en pleno uso de mis facultades mentales, otorgo el presente testamento conforme al artículo 1295 del Código Civil Federal.""")
                .section("PRIMERA.- Revocación", "Revoco cualquier testamento otorgado con anterioridad.")
                .section("SEGUNDA.- Institución de herederos", """
                        Instituyo como mis herederos a:
                        {{#herederos}}""")
                .section("TERCERA.- Bienes", """
                        Mis bienes son:
                        {{#bienes}}""")
                .section("CUARTA.- Disposición final", "Es mi voluntad que se respeten estas disposiciones.")
                .section("Firma", """
                        {{fecha_otorgamiento}}
                        %s
                        {{testador}}
                        TESTADOR""".formatted(SIGNATURE_LINE))
                .build();
    }
}

/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: MX Legal Assist
 */

package com.acme.mxlegal;

import com.acme.mxlegal.content.LegalContentLibrary;
import com.acme.mxlegal.model.AssessmentResult;
import com.acme.mxlegal.model.GeneratedDocument;
import com.acme.mxlegal.model.Outcome;
import com.acme.mxlegal.util.RiskUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "mx-legal-assist",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Generates Mexican legal documents and keyword-based legal assessments. Output is not legal advice.",
        subcommands = {
                LegalAssistApp.Generate.class,
                LegalAssistApp.Analyze.class,
                LegalAssistApp.Rights.class,
                LegalAssistApp.ContractValidity.class,
                LegalAssistApp.Criminal.class,
                LegalAssistApp.Templates.class
        }
)
public class LegalAssistApp implements Callable<Integer> {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LegalAssistApp()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    static class CommonOptions {
        @CommandLine.Option(names = "--out", description = "Write the result to this file instead of stdout.")
        Path out;

        @CommandLine.Option(names = "--fixed-time", description = "ISO-8601 instant used as generation time, for reproducible output.")
        Instant fixedTime;

        AssessmentOrchestrator orchestrator() {
            Clock clock = fixedTime == null ? Clock.systemUTC() : Clock.fixed(fixedTime, ZoneOffset.UTC);
            return new AssessmentOrchestrator(LegalContentLibrary.standard(), clock);
        }
    }

    @CommandLine.Command(name = "generate", mixinStandardHelpOptions = true,
            description = "Render a legal document from a JSON object of field values.")
    static class Generate implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @CommandLine.Option(names = "--type", required = true, description = "amparo, contract, lawsuit, power_of_attorney or will.")
        String type;

        @CommandLine.Option(names = "--fields", required = true, description = "Path to a JSON file with the document fields.")
        Path fieldsFile;

        @CommandLine.Option(names = "--format", defaultValue = "text", description = "text or json. Default: ${DEFAULT-VALUE}")
        String format;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> fields = MAPPER.readValue(fieldsFile.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put(AssessmentOrchestrator.DOCUMENT_TYPE, type);
            raw.put(AssessmentOrchestrator.FIELDS, fields);

            Outcome<GeneratedDocument> outcome = common.orchestrator().generateDocument(raw, RequestContext.create());
            if (outcome.isOk() && "text".equalsIgnoreCase(format)) {
                write(spec, common, outcome.value().renderedText());
                return 0;
            }
            return emit(spec, common, outcome);
        }
    }

    @CommandLine.Command(name = "analyze", mixinStandardHelpOptions = true,
            description = "Match case facts against the rule table of an area of law.")
    static class Analyze implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @CommandLine.Option(names = "--fact", required = true, description = "A fact of the case; repeat for several.")
        List<String> facts;

        @CommandLine.Option(names = "--question", required = true, description = "The legal question.")
        String question;

        @CommandLine.Option(names = "--area", description = "Area of law; inferred from the facts when omitted.")
        String area;

        @CommandLine.Option(names = "--risk-exit-code", defaultValue = "false",
                description = "Exit with 0/1/2 for low/medium/high overall risk. Default: ${DEFAULT-VALUE}")
        boolean riskExitCode;

        @Override
        public Integer call() throws Exception {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put(AssessmentOrchestrator.FACTS, facts);
            raw.put(AssessmentOrchestrator.LEGAL_QUESTION, question);
            if (area != null) raw.put(AssessmentOrchestrator.AREA, area);

            Outcome<AssessmentResult> outcome = common.orchestrator().analyzeCase(raw, RequestContext.create());
            int code = emit(spec, common, outcome);
            if (outcome.isOk()) {
                AssessmentResult r = outcome.value();
                if (common.out != null) {
                    spec.commandLine().getOut().println("Area: " + r.area() + ", findings: " + r.findings().size() + ", overall risk: " + r.overallRisk());
                }
                if (riskExitCode) return RiskUtil.exitCode(r.overallRisk());
            }
            return code;
        }
    }

    @CommandLine.Command(name = "rights", mixinStandardHelpOptions = true,
            description = "Check a situation for possibly violated constitutional rights.")
    static class Rights implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @CommandLine.Option(names = "--situation", required = true, description = "Description of the situation.")
        String situation;

        @Override
        public Integer call() throws Exception {
            return emit(spec, common, common.orchestrator().checkConstitutionalRights(situation, RequestContext.create()));
        }
    }

    @CommandLine.Command(name = "contract-validity", mixinStandardHelpOptions = true,
            description = "Check contract terms for consent, object, cause and form.")
    static class ContractValidity implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @CommandLine.Option(names = "--term", required = true, description = "A contract term; repeat for several.")
        List<String> terms;

        @Override
        public Integer call() throws Exception {
            return emit(spec, common, common.orchestrator().analyzeContractValidity(terms, RequestContext.create()));
        }
    }

    @CommandLine.Command(name = "criminal", mixinStandardHelpOptions = true,
            description = "Identify possible offenses under federal criminal law.")
    static class Criminal implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @CommandLine.Option(names = "--fact", required = true, description = "A fact of the case; repeat for several.")
        List<String> facts;

        @Override
        public Integer call() throws Exception {
            return emit(spec, common, common.orchestrator().assessCriminalLiability(facts, RequestContext.create()));
        }
    }

    @CommandLine.Command(name = "templates", mixinStandardHelpOptions = true,
            description = "List document types and their required fields.")
    static class Templates implements Callable<Integer> {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;
        @CommandLine.Mixin CommonOptions common;

        @Override
        public Integer call() throws Exception {
            Map<String, Set<String>> templates = new LinkedHashMap<>();
            common.orchestrator().availableTemplates().forEach((type, fields) -> templates.put(type.wire(), fields));
            write(spec, common, MAPPER.writeValueAsString(templates));
            return 0;
        }
    }

    static int emit(CommandLine.Model.CommandSpec spec, CommonOptions common, Outcome<?> outcome) throws Exception {
        if (!outcome.isOk()) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(MAPPER.writeValueAsString(outcome.error()));
            err.flush();
            return 1;
        }
        write(spec, common, MAPPER.writeValueAsString(outcome.value()));
        return 0;
    }

    static void write(CommandLine.Model.CommandSpec spec, CommonOptions common, String text) throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        if (common.out != null) {
            Files.writeString(common.out, text + System.lineSeparator(), StandardCharsets.UTF_8);
            out.println("Written: " + common.out);
        } else {
            out.println(text);
        }
        out.flush();
    }
}

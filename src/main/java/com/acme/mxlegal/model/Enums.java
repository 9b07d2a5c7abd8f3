package com.acme.mxlegal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public final class Enums {
    private Enums() {}

    public enum DocumentType {
        AMPARO("amparo", "amparo"),
        CONTRACT("contract", "contrato"),
        LAWSUIT("lawsuit", "demanda"),
        POWER_OF_ATTORNEY("power_of_attorney", "poder_notarial"),
        WILL("will", "testamento");

        private final String wire;
        private final String alias;

        DocumentType(String wire, String alias) { this.wire = wire; this.alias = alias; }

        @JsonValue
        public String wire() { return wire; }

        public static Optional<DocumentType> fromWire(String value) {
            if (value == null) return Optional.empty();
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (DocumentType t : values()) {
                if (t.wire.equals(v) || t.alias.equals(v)) return Optional.of(t);
            }
            return Optional.empty();
        }

        @Override public String toString() { return wire; }
    }

    public enum LegalArea {
        CONSTITUCIONAL, CIVIL, PENAL, LABORAL, MERCANTIL, ADMINISTRATIVO, FISCAL, FAMILIAR;

        @JsonValue
        public String wire() { return name().toLowerCase(Locale.ROOT); }

        public static Optional<LegalArea> fromWire(String value) {
            if (value == null) return Optional.empty();
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (LegalArea a : values()) {
                if (a.wire().equals(v)) return Optional.of(a);
            }
            return Optional.empty();
        }

        @Override public String toString() { return wire(); }
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH;

        @JsonValue
        @Override public String toString() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum ErrorKind {
        UNKNOWN_DOCUMENT_TYPE, UNKNOWN_AREA, MISSING_REQUIRED_FIELD, EMPTY_FACT_SET, INVALID_INPUT, CANCELLED
    }
}

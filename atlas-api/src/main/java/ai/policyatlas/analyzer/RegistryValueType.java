package ai.policyatlas.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RegistryValueType {
    REG_DWORD("REG_DWORD"),
    REG_QWORD("REG_QWORD"),
    REG_SZ("REG_SZ"),
    REG_EXPAND_SZ("REG_EXPAND_SZ"),
    REG_MULTI_SZ("REG_MULTI_SZ"),
    UNKNOWN("Unknown");

    private final String label;

    RegistryValueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}

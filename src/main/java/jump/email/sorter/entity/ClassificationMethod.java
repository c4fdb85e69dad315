package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassificationMethod {
    CACHED("cached"),
    RULE("rule"),
    KEYWORD("keyword"),
    REMOTE_SINGLE("remote-single"),
    REMOTE_BATCH("remote-batch"),
    FALLBACK("fallback");

    private final String label;

    ClassificationMethod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isRemote() {
        return this == REMOTE_SINGLE || this == REMOTE_BATCH;
    }
}

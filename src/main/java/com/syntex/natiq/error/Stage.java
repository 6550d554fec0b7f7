package com.syntex.natiq.error;

/**
 * Pipeline stage a {@link ConversionException} was raised in.
 */
public enum Stage {
    READ("read"),
    VALIDATE("validate"),
    PARSE("parse"),
    ANNOTATE("annotate"),
    ALIGN("align"),
    METADATA("metadata"),
    SERIALIZE("serialize"),
    WRITE("write");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

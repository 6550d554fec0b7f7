package com.syntex.natiq.quran.model;

import lombok.Value;

/**
 * Identity of one edition of the text, e.g. {@code hafs / Hafs an Asim / tanzil}.
 */
@Value
public class Mushaf {
    String shortName;
    String fullName;
    String sourceLabel;
}

package com.syntex.natiq.quran.model;

import lombok.Value;

@Value
public class Word {
    String text;
}

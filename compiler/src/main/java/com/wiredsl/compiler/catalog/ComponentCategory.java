package com.wiredsl.compiler.catalog;

public enum ComponentCategory {
    TEXT,
    ACTION,
    INPUT,
    NAVIGATION,
    DATA,
    MEDIA,
    LAYOUT,
    FEEDBACK
}

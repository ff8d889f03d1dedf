package com.logic.obdd.api;

/** What a file requested from the user will be used for. */
public enum FileAction {
    EXPORT,
    IMPORT
}

package com.questrail.junction.api;

/**
 * The seven transition templates, identified by their single-letter code.
 */
public enum TemplateCode
{
    /** Vehicle to vehicle. */
    A,
    /** Vehicle to LRT entry. */
    B,
    /** Vehicle to LRT anchor. */
    C,
    /** LRT to vehicle. */
    D,
    /** LRT to Lig. */
    E,
    /** Lig to vehicle. */
    F,
    /** LRT to LRT. */
    G
}

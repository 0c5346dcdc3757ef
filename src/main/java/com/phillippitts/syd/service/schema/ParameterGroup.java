package com.phillippitts.syd.service.schema;

/**
 * Pipeline stage a parameter belongs to.
 */
public enum ParameterGroup {
    /** High-level software behaviour: directories, saving, verbosity. */
    PARENT,
    /** Data loading and preparation. */
    DATA,
    /** Optional search-and-estimate stage for numax. */
    ESTIMATE,
    /** Background (noise-law) fit. */
    BACKGROUND,
    /** Global parameter derivation. */
    GLOBAL,
    /** Star properties that usually come from the catalog. */
    STAR
}

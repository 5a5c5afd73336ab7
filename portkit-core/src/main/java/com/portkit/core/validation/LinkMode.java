package com.portkit.core.validation;

/**
 * When the link step compiles a unit together with the rest of the project.
 */
public enum LinkMode {
    /** Link every unit */
    ALWAYS,

    /** Link only units that other units depend on */
    WHEN_DEPENDENTS,

    /** Never run the link step */
    NEVER
}

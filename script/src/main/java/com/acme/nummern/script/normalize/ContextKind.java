package com.acme.nummern.script.normalize;

/** Scope opened by a context header. */
public enum ContextKind {
    /** {@code with table_context(ref):} */
    TABLE,
    /** {@code with label_context(ref, 'region'):} */
    LABEL
}

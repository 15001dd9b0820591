package com.openforge.recall.retrieval;

/** How a retrieval source scores its hits; decides the retrieval method label. */
public enum SourceKind {
    SEMANTIC,
    LEXICAL
}

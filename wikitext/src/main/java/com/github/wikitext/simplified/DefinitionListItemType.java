package com.github.wikitext.simplified;

public enum DefinitionListItemType {
    TERM("Term", ';'),
    DETAILS("Details", ':');

    private final String label;
    private final char marker;

    DefinitionListItemType(String label, char marker) {
        this.label = label;
        this.marker = marker;
    }

    public char getMarker() {
        return marker;
    }

    @Override
    public String toString() {
        return label;
    }
}

package co.fanki.codemap.flow.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kinds of flow steps, with the Mermaid shape and style each one is
 * drawn with.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FlowKind {

    START("start", "((", "))",
            "fill:#1a3a5c,stroke:#58a6ff,stroke-width:2px,color:#58a6ff"),
    IMPORT("import", "[", "]",
            "fill:#1a3a3a,stroke:#39d2c0,stroke-width:1px,color:#39d2c0"),
    DEFINE("define", "([", "])",
            "fill:#2a1f3a,stroke:#bc8cff,stroke-width:2px,color:#bc8cff"),
    CLASS("class", "[[", "]]",
            "fill:#3a2a1a,stroke:#d29922,stroke-width:2px,color:#d29922"),
    ASSIGN("assign", "[", "]",
            "fill:#1a1f24,stroke:#484f58,stroke-width:1px,color:#8b949e"),
    CALL("call", "[", "]",
            "fill:#1a2f1a,stroke:#3fb950,stroke-width:1px,color:#3fb950"),
    CONDITION("condition", "{", "}",
            "fill:#3a2a1a,stroke:#d29922,stroke-width:1px,color:#d29922"),
    LOOP("loop", "([", "])",
            "fill:#2a1a2a,stroke:#f778ba,stroke-width:1px,color:#f778ba"),
    RETURN("return", "[/", "/]",
            "fill:#2a1a1a,stroke:#f85149,stroke-width:1px,color:#f85149");

    private final String kindName;

    private final String shapeOpen;

    private final String shapeClose;

    private final String style;

    FlowKind(final String theName, final String theOpen,
            final String theClose, final String theStyle) {
        kindName = theName;
        shapeOpen = theOpen;
        shapeClose = theClose;
        style = theStyle;
    }

    /**
     * Returns the lower-case name used in JSON and style classes.
     *
     * @return the kind name, e.g. {@code condition}
     */
    @JsonValue
    public String kindName() {
        return kindName;
    }

    public String shapeOpen() {
        return shapeOpen;
    }

    public String shapeClose() {
        return shapeClose;
    }

    /**
     * Returns the Mermaid style class of this kind.
     *
     * @return the class name, e.g. {@code conditionStyle}
     */
    public String styleClass() {
        return kindName + "Style";
    }

    /**
     * Returns the Mermaid {@code classDef} body of this kind.
     *
     * @return the style declaration
     */
    public String style() {
        return style;
    }

}

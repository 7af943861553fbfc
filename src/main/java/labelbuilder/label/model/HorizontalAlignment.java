package labelbuilder.label.model;

public enum HorizontalAlignment {
    LEFT,
    CENTER,
    RIGHT,
    /** Keeps the requested x coordinate. */
    NONE
}

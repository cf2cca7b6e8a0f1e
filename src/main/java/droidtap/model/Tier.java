package droidtap.model;

/**
 * Resolution strategies, in increasing cost order.
 */
public enum Tier {
    KNOWLEDGE_MAP,
    ACCESSIBILITY_TREE,
    ORDINAL_LIST,
    OPTICAL_TEXT,
    VISION
}

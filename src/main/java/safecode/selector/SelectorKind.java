package safecode.selector;

/** Shape of a CSS selector, judged from its leading character. */
public enum SelectorKind { ID, CLASS, ATTRIBUTE, COMPOUND, TAG, UNKNOWN }

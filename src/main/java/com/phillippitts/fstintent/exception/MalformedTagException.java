package com.phillippitts.fstintent.exception;

/**
 * Thrown when the tag markers of a decoded path do not nest properly: an {@code __end__}
 * that does not close the open tag, or a {@code __begin__} while another tag is still open.
 * Fatal for the path being decoded.
 */
public class MalformedTagException extends FstIntentException {

    private final String openTag;
    private final String offendingTag;

    public MalformedTagException(String openTag, String offendingTag) {
        super("Mismatched tags: open=" + (openTag == null ? "<none>" : openTag) + ", got=" + offendingTag);
        this.openTag = openTag;
        this.offendingTag = offendingTag;
    }

    /**
     * @return name of the tag open when the error occurred, or null if no tag was open
     */
    public String getOpenTag() {
        return openTag;
    }

    public String getOffendingTag() {
        return offendingTag;
    }
}

package io.shortcode.core.error;

/** Thrown when a call references a directive name absent from the handler registry. */
public final class UnknownDirectiveException extends ShortcodeRenderException {

    private static final long serialVersionUID = 1L;

    public UnknownDirectiveException(String directive, Integer nodeIndex) {
        super("Unknown directive: '" + directive + "'", directive, nodeIndex);
    }
}

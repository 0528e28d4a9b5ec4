package io.github.eutro.mirlens.core.ir;

/**
 * Thrown when an IR input breaks its contract: an edge or location points outside the body,
 * a block has no terminator, and similar. These are fatal; the analyses never try to repair
 * the graph.
 */
public class MalformedIrException extends IllegalArgumentException {
    /**
     * Construct the exception.
     *
     * @param message What was wrong with the input.
     */
    public MalformedIrException(String message) {
        super(message);
    }
}

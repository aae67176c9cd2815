package com.chaineditor.chain;

/**
 * An edit that cannot be applied to the chain, such as an index outside it.
 * The chain is left unchanged.
 */
public class ChainEditException extends RuntimeException {

    public ChainEditException(String message) {
        super(message);
    }
}

package com.sysmuse.hash;

/**
 * Raised at a file or field boundary once cancellation has been requested.
 */
public class RunCancelledException extends HashRunException {

    public RunCancelledException(String where) {
        super("Run cancelled " + where);
    }
}

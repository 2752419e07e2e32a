package com.sysmuse.hash;

/**
 * Produces one kind of artifact from the completed mapping store.
 * Generators only read the store and run after all collection has finished.
 */
public interface OutputGenerator {

    RunPhase getPhase();

    /**
     * Write this generator's artifacts, recording each one in the context
     *
     * @throws WriteException if an artifact cannot be written
     * @throws StoreException if the store cannot be queried
     */
    void generate(RunContext context);
}

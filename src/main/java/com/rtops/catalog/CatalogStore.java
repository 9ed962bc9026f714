package com.rtops.catalog;

import com.rtops.domain.CatalogRecord;
import com.rtops.domain.Tactic;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persistent technique catalog.
 * 
 * The store only ever grows: records are inserted when absent and updated in
 * place, never deleted. Read and write failures of the backing storage
 * surface as {@link CatalogStoreException}.
 */
public interface CatalogStore {
    
    /**
     * Find the record of a (technique, tactic) pair
     * 
     * @param techniqueId technique id
     * @param tactic tactic
     * @return a copy of the stored record, or empty
     */
    Optional<CatalogRecord> find(String techniqueId, Tactic tactic);
    
    /**
     * Insert a record unless its (technique, tactic) pair already exists
     * 
     * @param record record with createdAt set
     * @return true if the record was inserted
     */
    boolean insertIfAbsent(CatalogRecord record);
    
    /**
     * Overwrite name, description and references of an existing record.
     * createdAt is never changed.
     * 
     * @param record record carrying the new values
     * @return true if a stored record was updated
     */
    boolean update(CatalogRecord record);
    
    /**
     * @return all records, in storage order
     */
    List<CatalogRecord> findAll();
    
    long count();
    
    /**
     * @return true once an import pass has changed the catalog
     */
    boolean isPopulated();
    
    /**
     * Record that the catalog has been populated. The flag is never cleared.
     */
    void markPopulated();
    
    /**
     * Run work as one atomic unit; on failure, none of its writes remain
     * 
     * @param work the work to run
     * @return the work's result
     */
    <T> T inTransaction(Supplier<T> work);
}

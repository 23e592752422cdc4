package com.umitunal.leasejob.storage;

import com.umitunal.leasejob.model.JobRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable collection of job documents.
 * Every mutation of a single document is one atomic operation; there is
 * no read-then-write path.
 */
public interface JobStore extends AutoCloseable {

    /**
     * Insert a new job document.
     *
     * @return the stored document with its newly assigned id
     */
    JobRecord insert(String name, byte[] payload, long runAt) throws Exception;

    /**
     * Lease due, unleased jobs. Each lease is taken with a compare-and-swap
     * on the document: a job whose lease was taken by someone else between
     * the scan and the swap is skipped.
     *
     * @return only the documents this call leased, as stored after the swap
     */
    List<JobRecord> claimDue(ClaimRequest request) throws Exception;

    /**
     * Overwrite name, payload and run time and clear any lease.
     *
     * @return false if no document has this id
     */
    boolean replace(String jobId, String name, byte[] payload, long runAt) throws Exception;

    /**
     * @return true if a document was removed
     */
    boolean deleteById(String jobId) throws Exception;

    /**
     * Delete a document only while it still carries the given lease.
     * A document that was rescheduled or re-leased in the meantime is kept.
     *
     * @return true if a document was removed
     */
    boolean releaseClaim(String jobId, String owner, long lockedUntil) throws Exception;

    Optional<JobRecord> findById(String jobId) throws Exception;

    List<JobRecord> findAll() throws Exception;

    StoreMetrics getMetrics() throws Exception;

    String getCollectionName();

    @Override
    void close();
}

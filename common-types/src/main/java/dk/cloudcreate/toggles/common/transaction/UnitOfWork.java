package dk.cloudcreate.toggles.common.transaction;

/**
 * A unit of work spans a single logical transaction.<br>
 * Everything read or written through the {@link UnitOfWork} becomes durable together at {@link #commit()}
 * or is discarded together at {@link #rollback(Exception)}
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and the underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#Committed}
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback
     */
    void rollback(Exception cause);

    /**
     * Get the status of the {@link UnitOfWork}
     */
    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    void markAsRollbackOnly(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     */
    default void rollback() {
        // Use any exception saved using #markAsRollbackOnly(Exception)
        rollback(getCauseOfRollback());
    }
}

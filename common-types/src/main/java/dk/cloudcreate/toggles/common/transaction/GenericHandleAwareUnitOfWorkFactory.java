package dk.cloudcreate.toggles.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Generic {@link HandleAwareUnitOfWorkFactory} that binds the active {@link UnitOfWork} to the calling thread.<br>
 * Each {@link UnitOfWork} opens its own {@link Handle} and database transaction when started and closes the {@link Handle}
 * when the {@link UnitOfWork} is committed or rolled back.
 *
 * @param <UOW> the concrete {@link GenericHandleAwareUnitOfWork} sub type
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi              jdbi;
    private final ThreadLocal<UOW> unitsOfWork = new ThreadLocal<>();

    public GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    @Override
    public Jdbi getJdbi() {
        return jdbi;
    }

    /**
     * Create a new (not yet started) {@link UnitOfWork} instance
     *
     * @param unitOfWorkFactory this factory
     * @return the new {@link UnitOfWork}
     */
    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            log.trace("Creating new UnitOfWork");
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitsOfWork.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitsOfWork.get());
    }

    private void removeUnitOfWork() {
        log.trace("Removing UnitOfWork from the current thread");
        unitsOfWork.remove();
    }

    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private final Logger                                    log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWork.class);
        private final GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
        private       Handle                                    handle;
        private       UnitOfWorkStatus                          status;
        private       Exception                                 causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.trace("Starting UnitOfWork with initial status {}", status);
                handle = unitOfWorkFactory.jdbi.open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close();
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started) {
                log.trace("Committing UnitOfWork");
                try {
                    handle.commit();
                } catch (RuntimeException e) {
                    status = UnitOfWorkStatus.RolledBack;
                    causeOfRollback = e;
                    close();
                    throw new UnitOfWorkException("Failed to commit the UnitOfWork", e);
                }
                status = UnitOfWorkStatus.Committed;
                close();
            } else if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback();
            } else {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                log.debug("Rolling back UnitOfWork{}", causeOfRollback != null ? " due to " + causeOfRollback.getClass().getSimpleName() : "");
                try {
                    handle.rollback();
                } finally {
                    status = UnitOfWorkStatus.RolledBack;
                    close();
                }
            } else if (status != UnitOfWorkStatus.RolledBack) {
                throw new UnitOfWorkException(msg("Cannot rollback a UnitOfWork with status {}", status));
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                throw new UnitOfWorkException(msg("Cannot mark a UnitOfWork with status {} as rollback only", status));
            }
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("No active transaction. UnitOfWork status {}", status));
            }
            return handle;
        }

        private void close() {
            try {
                if (handle != null) {
                    handle.close();
                }
            } finally {
                handle = null;
                unitOfWorkFactory.removeUnitOfWork();
            }
        }
    }
}

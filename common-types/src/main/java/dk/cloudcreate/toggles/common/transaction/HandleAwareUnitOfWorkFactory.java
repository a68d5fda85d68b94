package dk.cloudcreate.toggles.common.transaction;

import org.jdbi.v3.core.Jdbi;

/**
 * Specialization of {@link UnitOfWorkFactory} that creates and maintains {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
    /**
     * @return the {@link Jdbi} instance that the {@link HandleAwareUnitOfWork}'s open their {@link org.jdbi.v3.core.Handle}'s from
     */
    Jdbi getJdbi();
}

package dk.cloudcreate.toggles.common.transaction;

import org.jdbi.v3.core.Jdbi;

/**
 * {@link GenericHandleAwareUnitOfWorkFactory} that creates plain {@link GenericHandleAwareUnitOfWork}'s
 */
public class JdbiUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> {
    public JdbiUnitOfWorkFactory(Jdbi jdbi) {
        super(jdbi);
    }

    @Override
    protected GenericHandleAwareUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> unitOfWorkFactory) {
        return new GenericHandleAwareUnitOfWork(unitOfWorkFactory);
    }
}

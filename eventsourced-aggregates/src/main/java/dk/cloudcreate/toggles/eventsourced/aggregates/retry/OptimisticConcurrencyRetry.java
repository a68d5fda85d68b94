package dk.cloudcreate.toggles.eventsourced.aggregates.retry;

import dk.cloudcreate.toggles.common.transaction.*;
import dk.cloudcreate.toggles.eventstore.postgresql.persistence.OptimisticAppendToStreamException;
import org.slf4j.*;

import java.util.Optional;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Runs a complete read, decide and persist attempt and repeats it when it fails with an {@link OptimisticAppendToStreamException}.<br>
 * Any other exception is propagated immediately. When the {@link ConcurrencyRetryPolicy#maximumNumberOfAttempts} are exhausted
 * the last {@link OptimisticAppendToStreamException} is rethrown.<br>
 * <br>
 * A failed append leaves the database transaction it ran in unusable. Each attempt therefore has to run in its own
 * {@link UnitOfWork}: when a {@link UnitOfWorkFactory} is supplied and the calling thread already has an active {@link UnitOfWork},
 * the conflict is rethrown after the first attempt and the caller decides whether to repeat its whole transaction.
 */
public class OptimisticConcurrencyRetry {
    private static final Logger log = LoggerFactory.getLogger(OptimisticConcurrencyRetry.class);

    private final ConcurrencyRetryPolicy                            retryPolicy;
    private final Optional<UnitOfWorkFactory<? extends UnitOfWork>> unitOfWorkFactory;

    /**
     * Retry without checking for an active {@link UnitOfWork}. Only use this if the attempts never run inside a caller's transaction
     */
    public OptimisticConcurrencyRetry(ConcurrencyRetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "No retryPolicy provided");
        this.unitOfWorkFactory = Optional.empty();
    }

    /**
     * @param retryPolicy       the retry policy
     * @param unitOfWorkFactory the factory whose active {@link UnitOfWork} (if any) the attempts join
     */
    public OptimisticConcurrencyRetry(ConcurrencyRetryPolicy retryPolicy, UnitOfWorkFactory<? extends UnitOfWork> unitOfWorkFactory) {
        this.retryPolicy = requireNonNull(retryPolicy, "No retryPolicy provided");
        this.unitOfWorkFactory = Optional.of(requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided"));
    }

    public <R> R execute(Supplier<R> attempt) {
        requireNonNull(attempt, "No attempt provided");
        var attemptNumber = 1;
        while (true) {
            try {
                return attempt.get();
            } catch (OptimisticAppendToStreamException e) {
                if (isJoiningAnActiveUnitOfWork()) {
                    log.debug("Not retrying the concurrent modification of aggregate with id '{}' as the attempt joined an already active UnitOfWork", e.aggregateId);
                    throw e;
                }
                if (attemptNumber >= retryPolicy.maximumNumberOfAttempts) {
                    log.debug("Giving up after {} attempt(s) due to concurrent modification of aggregate with id '{}'", attemptNumber, e.aggregateId);
                    throw e;
                }
                log.debug("Attempt {} of {} failed due to concurrent modification of aggregate with id '{}' at generation {}. Retrying",
                          attemptNumber,
                          retryPolicy.maximumNumberOfAttempts,
                          e.aggregateId,
                          e.generation);
                if (!sleepBeforeNextAttempt()) {
                    throw e;
                }
                attemptNumber++;
            }
        }
    }

    private boolean isJoiningAnActiveUnitOfWork() {
        return unitOfWorkFactory.map(factory -> factory.getCurrentUnitOfWork().isPresent())
                                .orElse(false);
    }

    private boolean sleepBeforeNextAttempt() {
        if (retryPolicy.delayBetweenAttempts.isZero()) {
            return true;
        }
        try {
            Thread.sleep(retryPolicy.delayBetweenAttempts.toMillis());
            return true;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for the next attempt");
            return false;
        }
    }

    @Override
    public String toString() {
        return "OptimisticConcurrencyRetry{" +
                "retryPolicy=" + retryPolicy +
                ", unitOfWorkAware=" + unitOfWorkFactory.isPresent() +
                '}';
    }
}

package tech.keyledger.activation.panache;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import tech.keyledger.activation.LedgerTransaction;
import tech.keyledger.license.License;
import tech.keyledger.license.entity.LicenseEntity;
import tech.keyledger.license.mapper.LicenseMapper;
import tech.keyledger.platform.common.TransientStorageException;
import tech.keyledger.platform.config.LicensingConfig;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * JTA implementation of {@link LedgerTransaction}.
 *
 * <p>The license scope is a {@code SELECT ... FOR UPDATE} on the license row, bounded by
 * {@code keyledger.activation.lock-timeout} through a transaction-local PostgreSQL
 * {@code lock_timeout}, since Hibernate drops positive JPA lock timeouts on PostgreSQL.
 * Concurrent activations of one license queue behind it while other licenses proceed.
 * The unique constraint on {@code activations(license_id, domain)} backs this up if the
 * lock is ever bypassed.
 */
@ApplicationScoped
public class PanacheLedgerTransaction implements LedgerTransaction {

    private static final Logger LOG = Logger.getLogger(PanacheLedgerTransaction.class);

    @Inject
    EntityManager em;

    @Inject
    LicensingConfig config;

    @Override
    public <T> T inLicenseScope(String licenseId, Function<Optional<License>, T> work) {
        Duration lockTimeout = config.activation().lockTimeout();
        return run(() -> {
            applyLockTimeout(lockTimeout);
            LicenseEntity locked = em.find(LicenseEntity.class, licenseId, LockModeType.PESSIMISTIC_WRITE);
            T result = work.apply(Optional.ofNullable(locked).map(LicenseMapper::toDomain));
            em.flush();
            return result;
        }, "license scope " + licenseId);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return run(() -> {
            T result = work.get();
            em.flush();
            return result;
        }, "ledger transaction");
    }

    private void applyLockTimeout(Duration lockTimeout) {
        em.createNativeQuery("SELECT set_config('lock_timeout', :timeout, true)")
            .setParameter("timeout", lockTimeout.toMillis() + "ms")
            .getSingleResult();
    }

    private <T> T run(Supplier<T> body, String description) {
        int timeoutSeconds = (int) Math.max(1, config.activation().lockTimeout().toSeconds() * 2);
        try {
            return QuarkusTransaction.requiringNew()
                .timeout(timeoutSeconds)
                .call(body::get);
        } catch (PersistenceException | QuarkusTransactionException e) {
            LOG.warnf("Storage failure in %s: %s", description, e.getMessage());
            throw new TransientStorageException("Storage unavailable during " + description, e);
        }
    }
}

package tech.keyledger.activation;

import tech.keyledger.license.License;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Transaction boundary for ledger mutations.
 *
 * <p>Each call runs its work in a fresh transaction that either commits completely or
 * leaves no trace. Storage failures surface as
 * {@link tech.keyledger.platform.common.TransientStorageException}.
 */
public interface LedgerTransaction {

    /**
     * Run {@code work} while holding the exclusive lock on the license, so that capacity
     * checks and inserts for one license never interleave. The work receives the license
     * as read under the lock, or empty if it no longer exists.
     */
    <T> T inLicenseScope(String licenseId, Function<Optional<License>, T> work);

    /**
     * Run {@code work} in a transaction without taking the license lock.
     */
    <T> T inTransaction(Supplier<T> work);
}

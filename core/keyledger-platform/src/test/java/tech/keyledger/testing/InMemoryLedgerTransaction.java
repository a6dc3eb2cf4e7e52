package tech.keyledger.testing;

import tech.keyledger.activation.LedgerTransaction;
import tech.keyledger.license.License;
import tech.keyledger.license.LicenseRepository;
import tech.keyledger.platform.common.TransientStorageException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link LedgerTransaction} backed by one lock per license, standing in for the row lock.
 * {@link #failNext(int)} makes the next calls fail before any work runs.
 */
public class InMemoryLedgerTransaction implements LedgerTransaction {

    private final LicenseRepository licenses;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();

    public InMemoryLedgerTransaction(LicenseRepository licenses) {
        this.licenses = licenses;
    }

    public void failNext(int count) {
        pendingFailures.set(count);
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public <T> T inLicenseScope(String licenseId, Function<Optional<License>, T> work) {
        begin();
        ReentrantLock lock = locks.computeIfAbsent(licenseId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.apply(licenses.findById(licenseId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        begin();
        return work.get();
    }

    private void begin() {
        calls.incrementAndGet();
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransientStorageException("Simulated storage failure");
        }
    }
}

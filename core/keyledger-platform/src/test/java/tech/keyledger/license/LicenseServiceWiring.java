package tech.keyledger.license;

import tech.keyledger.activation.ActivationRepository;
import tech.keyledger.license.key.LicenseKeyService;

import java.time.Clock;

/**
 * Hand wiring of {@link LicenseService} for tests outside this package.
 */
public final class LicenseServiceWiring {

    private LicenseServiceWiring() {
    }

    public static LicenseService create(LicenseRepository licenses, ActivationRepository activations,
                                        LicenseKeyService keyService, Clock clock) {
        LicenseService service = new LicenseService();
        service.licenseRepository = licenses;
        service.activationRepository = activations;
        service.keyService = keyService;
        service.clock = clock;
        return service;
    }
}

package tech.keyledger.license.key;

import tech.keyledger.license.LicenseRepository;
import tech.keyledger.platform.config.LicensingConfig;
import tech.keyledger.platform.security.secrets.ServerSecrets;

import java.time.Clock;

/**
 * Hand wiring of {@link LicenseKeyService} for tests outside this package.
 */
public final class KeyServiceWiring {

    private KeyServiceWiring() {
    }

    public static LicenseKeyService create(LicenseRepository licenses, ServerSecrets secrets,
                                           LicensingConfig config, Clock clock) {
        LicenseKeyService service = new LicenseKeyService();
        service.licenseRepository = licenses;
        service.secrets = secrets;
        service.config = config;
        service.clock = clock;
        return service;
    }
}

package tech.keyledger.api;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.keyledger.activation.ActivationReceipt;
import tech.keyledger.engine.DeactivationReceipt;
import tech.keyledger.engine.LicensingEngine;
import tech.keyledger.license.EffectiveStatus;
import tech.keyledger.platform.common.Result;
import tech.keyledger.platform.common.errors.LicensingError;
import tech.keyledger.platform.ratelimit.RateLimitAction;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LicenseResourceTest {

    private static final String KEY = "0123ABCD-4567EF01-89ABCDEF-DEADBEEF";

    @Mock
    LicensingEngine engine;

    @Mock(strictness = Mock.Strictness.LENIENT)
    HttpHeaders headers;

    @InjectMocks
    LicenseResource resource;

    // ========================================================================
    // Activate
    // ========================================================================

    @Test
    @DisplayName("activate should rate limit on the first forwarded address")
    void activate_shouldUseForwardedAddress_whenHeaderPresent() {
        // Arrange
        when(headers.getHeaderString("X-Forwarded-For")).thenReturn("203.0.113.9, 10.0.0.1");
        when(engine.checkRate("203.0.113.9", RateLimitAction.ACTIVATE)).thenReturn(true);
        ActivationReceipt receipt = new ActivationReceipt("lic_1", "example.com", EffectiveStatus.ACTIVE,
            Instant.parse("2030-01-01T00:00:00Z"), 2, false, false);
        when(engine.activate(KEY, "example.com", "203.0.113.9", null)).thenReturn(new Result.Success<>(receipt));

        // Act
        Response response = resource.activate(new LicenseApi.ActivateRequest(KEY, "example.com"), headers, null);

        // Assert
        assertThat(response.getStatus()).isEqualTo(200);
        LicenseApi.ActivationResponse body = (LicenseApi.ActivationResponse) response.getEntity();
        assertThat(body.status()).isEqualTo("active");
        assertThat(body.remainingActivations()).isEqualTo(2);
    }

    @Test
    @DisplayName("activate should answer 429 without touching the ledger when throttled")
    void activate_shouldReturn429_whenRateLimited() {
        when(engine.checkRate(ClientIpResolver.UNKNOWN, RateLimitAction.ACTIVATE)).thenReturn(false);

        Response response = resource.activate(new LicenseApi.ActivateRequest(KEY, "example.com"), headers, null);

        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(((LicenseApi.FailureResponse) response.getEntity()).reason()).isEqualTo("rate_limited");
        verify(engine, never()).activate(any(), any(), any(), any());
    }

    @Test
    @DisplayName("activate should reject a missing body")
    void activate_shouldReturn400_whenBodyMissing() {
        when(engine.checkRate(ClientIpResolver.UNKNOWN, RateLimitAction.ACTIVATE)).thenReturn(true);

        Response response = resource.activate(null, headers, null);

        assertThat(response.getStatus()).isEqualTo(400);
        verify(engine, never()).activate(any(), any(), any(), any());
    }

    @Test
    @DisplayName("activate should map a capacity denial to 409")
    void activate_shouldReturn409_whenLimitReached() {
        when(engine.checkRate(ClientIpResolver.UNKNOWN, RateLimitAction.ACTIVATE)).thenReturn(true);
        when(engine.activate(KEY, "c.com", ClientIpResolver.UNKNOWN, null))
            .thenReturn(new Result.Failure<>(LicensingError.activationLimit(2)));

        Response response = resource.activate(new LicenseApi.ActivateRequest(KEY, "c.com"), headers, null);

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(((LicenseApi.FailureResponse) response.getEntity()).reason()).isEqualTo("activation_limit");
    }

    // ========================================================================
    // Validate / Deactivate
    // ========================================================================

    @Test
    @DisplayName("validate should use its own rate-limit action")
    void validate_shouldReturn403_whenDomainNotActivated() {
        when(engine.checkRate(ClientIpResolver.UNKNOWN, RateLimitAction.VALIDATE)).thenReturn(true);
        when(engine.validateHeartbeat(KEY, "example.com", ClientIpResolver.UNKNOWN))
            .thenReturn(new Result.Failure<>(LicensingError.domainNotActivated()));

        Response response = resource.validate(new LicenseApi.ValidateRequest(KEY, "example.com"), headers, null);

        assertThat(response.getStatus()).isEqualTo(403);
        verify(engine, never()).checkRate(any(), eq(RateLimitAction.ACTIVATE));
    }

    @Test
    @DisplayName("deactivate should report the remaining slots")
    void deactivate_shouldReturnRemainingActivations() {
        when(headers.getHeaderString("X-Real-IP")).thenReturn("198.51.100.7");
        when(engine.checkRate("198.51.100.7", RateLimitAction.DEACTIVATE)).thenReturn(true);
        when(engine.deactivate(KEY, "example.com"))
            .thenReturn(new Result.Success<>(new DeactivationReceipt("lic_1", "example.com", 3)));

        Response response = resource.deactivate(new LicenseApi.DeactivateRequest(KEY, "example.com"), headers, null);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(((LicenseApi.DeactivationResponse) response.getEntity()).remainingActivations()).isEqualTo(3);
    }
}

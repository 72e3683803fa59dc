package com.ai.echomi.service;

import com.ai.echomi.client.OtpBackendClient;
import com.ai.echomi.dto.OtpFetchResult;
import com.ai.echomi.dto.OtpReleaseRequest;
import com.ai.echomi.entity.OrderStatus;
import com.ai.echomi.exception.OrderNotFoundException;
import com.ai.echomi.exception.OtpNotReleasableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OtpReleaseServiceTest {

    private OrderLedger ledger;
    private OtpBackendClient backend;
    private OtpReleaseService service;

    @BeforeEach
    void setUp() {
        ledger = new OrderLedger();
        backend = mock(OtpBackendClient.class);
        service = new OtpReleaseService(ledger, backend);
    }

    private String approvedOrder(String otp) {
        String id = ledger.add("Zomato", otp, null);
        ledger.setStatus(id, OrderStatus.APPROVED);
        return id;
    }

    @Test
    void shouldReleaseStoredOtpWithoutAskingBackend() {
        String id = approvedOrder("4821");

        OtpFetchResult result = service.release(new OtpReleaseRequest("uid-1", "Zomato", id));

        assertEquals("4821", result.getOtp());
        assertEquals("Zomato", result.getCompany());
        assertFalse(result.isFallback());
        assertEquals(OrderStatus.COMPLETED, ledger.get(id).orElseThrow().getStatus());
        verify(backend, never()).fetchOtp(any(), any(), any());
    }

    @Test
    void shouldFetchOtpFromBackendWhenNoneStored() {
        String id = approvedOrder(null);
        when(backend.fetchOtp("uid-1", "Zomato", id))
                .thenReturn(OtpFetchResult.builder().otp("5555").company("Zomato").orderId(id).build());

        OtpFetchResult result = service.release(new OtpReleaseRequest("uid-1", null, id));

        assertEquals("5555", result.getOtp());
        assertFalse(result.isFallback());
    }

    @Test
    void shouldFlagPlaceholderFromBackend() {
        String id = approvedOrder(null);
        when(backend.fetchOtp(any(), any(), any())).thenReturn(OtpFetchResult.builder()
                .otp("123456").fallback(true).error("backend unreachable").build());

        OtpFetchResult result = service.release(new OtpReleaseRequest(null, "Zomato", id));

        assertEquals("123456", result.getOtp());
        assertTrue(result.isFallback());
    }

    @Test
    void shouldRefuseUnapprovedOrder() {
        String id = ledger.add("Zomato", "4821", null);

        OtpNotReleasableException ex = assertThrows(OtpNotReleasableException.class,
                () -> service.release(new OtpReleaseRequest(null, null, id)));
        assertEquals("The delivery hasn't been approved yet.", ex.getMessage());
    }

    @Test
    void shouldRejectMissingOrUnknownOrder() {
        assertThrows(IllegalArgumentException.class, () -> service.release(new OtpReleaseRequest(null, null, " ")));
        assertThrows(OrderNotFoundException.class, () -> service.release(new OtpReleaseRequest(null, null, "nope")));
    }
}

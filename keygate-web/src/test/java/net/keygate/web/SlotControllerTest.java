package net.keygate.web;

import net.keygate.core.error.InvalidTokenException;
import net.keygate.core.error.RejectionReason;
import net.keygate.core.error.ResourceNotFoundException;
import net.keygate.core.model.AcquireResult;
import net.keygate.core.model.IssuedToken;
import net.keygate.core.model.ReleaseOutcome;
import net.keygate.core.model.SlotResult;
import net.keygate.core.service.AllocationCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class SlotControllerTest {

    private AllocationCoordinator coordinator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(AllocationCoordinator.class);
        mvc = MockMvcBuilders.standaloneSetup(new SlotController(coordinator))
                .setControllerAdvice(new KeygateExceptionHandler())
                .build();
    }

    @Test
    void acquire_granted_returnsTokenAndSlot() throws Exception {
        var token = new IssuedToken(5L, "raw-slot-token", Instant.parse("2026-01-01T02:00:00Z"));
        when(coordinator.acquireSlot(eq(7L), eq("host-a"), anyString()))
                .thenReturn(AcquireResult.granted(11L, token, 1, 2));

        mvc.perform(post("/api/slots/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7,\"holder\":\"host-a\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("granted"))
                .andExpect(jsonPath("$.slotId").value(11))
                .andExpect(jsonPath("$.token").value("raw-slot-token"))
                .andExpect(jsonPath("$.retryAfter").doesNotExist());
    }

    @Test
    void acquire_wait_is200WithRetryAfter() throws Exception {
        when(coordinator.acquireSlot(eq(7L), eq("host-c"), anyString()))
                .thenReturn(AcquireResult.waitFor(AcquireResult.WaitReason.CAPACITY_FULL, 2, 2, Duration.ofSeconds(30)));

        mvc.perform(post("/api/slots/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7,\"holder\":\"host-c\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.status").value("wait"))
                .andExpect(jsonPath("$.reason").value("capacity_full"))
                .andExpect(jsonPath("$.active").value(2))
                .andExpect(jsonPath("$.max").value(2))
                .andExpect(jsonPath("$.retryAfter").value(30))
                .andExpect(jsonPath("$.token").doesNotExist());
    }

    @Test
    void acquire_unknownProduct_is404() throws Exception {
        when(coordinator.acquireSlot(anyLong(), anyString(), anyString()))
                .thenThrow(new ResourceNotFoundException("Product", 99L));

        mvc.perform(post("/api/slots/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":99,\"holder\":\"h\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void acquire_missingHolder_is400() throws Exception {
        mvc.perform(post("/api/slots/acquire")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":7}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(coordinator);
    }

    @Test
    void release_withBearer_passesRawTokenThrough() throws Exception {
        when(coordinator.releaseSlot(eq(11L), eq("raw-slot-token"), eq(SlotResult.SUCCESS), eq(420), anyString()))
                .thenReturn(ReleaseOutcome.RELEASED);

        mvc.perform(post("/api/slots/11/release")
                        .header("Authorization", "Bearer raw-slot-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"success\",\"elapsedSeconds\":420}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("released"));
    }

    @Test
    void release_twice_is409() throws Exception {
        when(coordinator.releaseSlot(eq(11L), anyString(), any(), any(), anyString()))
                .thenReturn(ReleaseOutcome.ALREADY_RELEASED);

        mvc.perform(post("/api/slots/11/release")
                        .header("Authorization", "Bearer raw-slot-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"error\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("already_released"));
    }

    @Test
    void release_withoutBearer_is401_withoutCallingCoordinator() throws Exception {
        mvc.perform(post("/api/slots/11/release")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"success\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value(InvalidTokenException.MESSAGE));
        verifyNoInteractions(coordinator);
    }

    @Test
    void release_badToken_is401_withOpaqueMessage() throws Exception {
        when(coordinator.releaseSlot(eq(11L), anyString(), any(), any(), anyString()))
                .thenThrow(new InvalidTokenException(RejectionReason.SUBJECT_MISMATCH));

        mvc.perform(post("/api/slots/11/release")
                        .header("Authorization", "Bearer someone-elses-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"success\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("WWW-Authenticate"))
                .andExpect(jsonPath("$.message").value("Invalid, expired, or already-used token"));
    }

    @Test
    void release_unknownResult_is400() throws Exception {
        mvc.perform(post("/api/slots/11/release")
                        .header("Authorization", "Bearer raw-slot-token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":\"maybe\"}"))
                .andExpect(status().isBadRequest());
    }
}

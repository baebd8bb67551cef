package net.keygate.web;

import net.keygate.core.error.InvalidTokenException;
import net.keygate.core.error.RejectionReason;
import net.keygate.core.model.CredentialPayload;
import net.keygate.core.model.Partition;
import net.keygate.core.model.ProductPayload;
import net.keygate.core.service.AllocationCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HandoffControllerTest {

    private AllocationCoordinator coordinator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(AllocationCoordinator.class);
        mvc = MockMvcBuilders.standaloneSetup(new HandoffController(coordinator))
                .setControllerAdvice(new KeygateExceptionHandler())
                .build();
    }

    @Test
    void credential_validBearer_deliversPayload_noStore() throws Exception {
        when(coordinator.fetchCredentialPayload(eq("abc_DEF-123"), anyString()))
                .thenReturn(new CredentialPayload(9L, Partition.AUTO_ASSIGN, "[Interface]"));

        mvc.perform(get("/api/handoff/credential").header("Authorization", "bearer abc_DEF-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", "no-store"))
                .andExpect(jsonPath("$.payload").value("[Interface]"));
    }

    @Test
    void credential_reusedToken_is401() throws Exception {
        when(coordinator.fetchCredentialPayload(anyString(), anyString()))
                .thenThrow(new InvalidTokenException(RejectionReason.ALREADY_CONSUMED));

        mvc.perform(get("/api/handoff/credential").header("Authorization", "Bearer abc"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value(InvalidTokenException.MESSAGE));
    }

    @Test
    void malformedHeaders_are401() throws Exception {
        mvc.perform(get("/api/handoff/product").header("Authorization", "Basic dXNlcjpwdw=="))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/handoff/product").header("Authorization", "Bearer    "))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/api/handoff/product"))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(coordinator);
    }

    @Test
    void product_validBearer_deliversPayload() throws Exception {
        when(coordinator.fetchProductPayload(eq("tok"), anyString()))
                .thenReturn(new ProductPayload(3L, "viewer", "https://dl/viewer", "viewer.msi"));

        mvc.perform(get("/api/handoff/product").header("Authorization", "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.downloadFilename").value("viewer.msi"));
    }
}

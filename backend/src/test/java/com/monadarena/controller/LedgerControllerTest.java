package com.monadarena.controller;

import com.monadarena.dto.LedgerRequests;
import com.monadarena.dto.LedgerResponses;
import com.monadarena.service.LedgerService;
import com.monadarena.web.ArenaOperationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LedgerController.class)
class LedgerControllerTest {

    private static final String ALICE = "0x" + "a".repeat(40);
    private static final String BOB = "0x" + "b".repeat(40);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LedgerService ledgerService;

    @Test
    void depositReturnsUpdatedBalance() throws Exception {
        when(ledgerService.creditExternalDeposit(eq(ALICE), any(LedgerRequests.DepositRequest.class)))
                .thenReturn(new LedgerResponses.AccountBalance(ALICE, 50_000_000L, false, OffsetDateTime.now()));

        mockMvc.perform(post("/api/ledger/accounts/" + ALICE + "/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":50000000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.walletAddress").value(ALICE))
                .andExpect(jsonPath("$.balance").value(50_000_000))
                .andExpect(jsonPath("$.payoutsBlocked").value(false));
    }

    @Test
    void depositRejectsNonPositiveAmount() throws Exception {
        mockMvc.perform(post("/api/ledger/accounts/" + ALICE + "/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_failed"))
                .andExpect(jsonPath("$.fieldErrors.amount").value("amount must be positive"));

        verifyNoInteractions(ledgerService);
    }

    @Test
    void getAccountMapsInvalidWallet() throws Exception {
        when(ledgerService.getAccount("not-a-wallet"))
                .thenThrow(ArenaOperationException.invalidWallet("Malformed wallet address: not-a-wallet"));

        mockMvc.perform(get("/api/ledger/accounts/not-a-wallet"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_wallet"));
    }

    @Test
    void payoutBlockRequiresCallerAndFlag() throws Exception {
        mockMvc.perform(put("/api/ledger/accounts/" + ALICE + "/payout-block")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.wallet").value("wallet is required"))
                .andExpect(jsonPath("$.fieldErrors.blocked").value("blocked is required"));

        verifyNoInteractions(ledgerService);
    }

    @Test
    void payoutBlockFromNonResolverIsForbidden() throws Exception {
        when(ledgerService.setPayoutsBlocked(eq(ALICE), any(LedgerRequests.PayoutBlockRequest.class)))
                .thenThrow(ArenaOperationException.notResolver());

        mockMvc.perform(put("/api/ledger/accounts/" + ALICE + "/payout-block")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"wallet\":\"" + BOB + "\",\"blocked\":true}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("not_resolver"));
    }

    @Test
    void escrowSummaryReturnsTotals() throws Exception {
        when(ledgerService.getEscrowSummary())
                .thenReturn(new LedgerResponses.EscrowSummary(20_000_000L, 40_000_000L, 60_000_000L));

        mockMvc.perform(get("/api/ledger/escrow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matchEscrow").value(20_000_000))
                .andExpect(jsonPath("$.totalEscrow").value(60_000_000));
    }
}

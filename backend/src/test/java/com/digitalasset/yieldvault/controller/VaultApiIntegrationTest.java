// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.dto.BackstopSwapRequest;
import com.digitalasset.yieldvault.dto.DepositRequest;
import com.digitalasset.yieldvault.dto.FaucetRequest;
import com.digitalasset.yieldvault.dto.ManagerSwapRequest;
import com.digitalasset.yieldvault.dto.WithdrawRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end HTTP tests against the simulated deployment from application.yml.
 *
 * The context (and its world) is shared by all tests, so each test uses its own holders and
 * only moves the clock forward.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Vault API Integration Tests")
class VaultApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MeterRegistry meterRegistry;

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(body)));
    }

    private String fund(String label, String asset, String amount) throws Exception {
        String holder = Address.derive(label).value();
        postJson("/api/devnet/faucet", new FaucetRequest(holder, asset, amount))
                .andExpect(status().isOk());
        return holder;
    }

    @Test
    @DisplayName("Deposit, locked withdrawal, then withdrawal after the lock-up")
    void testDepositLockAndWithdraw() throws Exception {
        // Arrange
        String holder = fund("api-lock", "rETH", "1");

        // Act + Assert
        postJson("/api/vault/deposit", new DepositRequest(holder, "rETH", "1", false))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.asset").value("rETH"))
                .andExpect(jsonPath("$.sharesMinted").value(notNullValue()));

        postJson("/api/vault/withdraw", new WithdrawRequest(holder, "0.5"))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.error").value("COME_BACK_LATER"))
                .andExpect(jsonPath("$.details.lockedUntil").value(notNullValue()));

        mockMvc.perform(get("/api/vault/positions/" + holder))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.locked").value(true));

        mockMvc.perform(post("/api/devnet/advance-time").param("seconds", "86400"))
                .andExpect(status().isOk());

        postJson("/api/vault/withdraw", new WithdrawRequest(holder, "0.5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sharesBurned").value("0.5"))
                .andExpect(jsonPath("$.settlementAsset").value("WETH"));

        assertTrue(meterRegistry.counter("yieldvault.vault.deposits.total", "asset", "rETH").count() >= 1.0);
    }

    @Test
    @DisplayName("Bean validation failures are reported field by field")
    void testMissingFields() throws Exception {
        postJson("/api/vault/deposit", new DepositRequest())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.holder").value(notNullValue()));
    }

    @Test
    @DisplayName("Malformed bodies are a bad request")
    void testUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/vault/deposit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Domain errors map to their HTTP status")
    void testStatusMapping() throws Exception {
        String holder = fund("api-errors", "WETH", "1");
        ManagerSwapRequest swap = new ManagerSwapRequest();
        swap.caller = holder;
        swap.swapper = Address.derive("swapper:devnet-router").value();
        swap.tokenIn = "rETH";
        swap.amountIn = "1";
        swap.tokenOut = "WETH";
        swap.minAmountOut = "0";

        postJson("/api/vault/deposit", new DepositRequest(holder, "DOGE", "1", false))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("UNKNOWN_ASSET"));
        postJson("/api/vault/deposit", new DepositRequest(holder, "WETH", "0.001", false))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("TOO_SMALL"));
        postJson("/api/strategy/swap", swap)
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
        postJson("/api/backstop/swap-native", new BackstopSwapRequest(holder, "1000000"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_BALANCE"));
    }

    @Test
    @DisplayName("Manager swaps through an unknown venue are unprocessable")
    void testInvalidSwapper() throws Exception {
        ManagerSwapRequest swap = new ManagerSwapRequest();
        swap.caller = Address.derive("manager").value();
        swap.swapper = Address.derive("swapper:unknown").value();
        swap.tokenIn = "rETH";
        swap.amountIn = "1";
        swap.tokenOut = "WETH";
        swap.minAmountOut = "0";

        postJson("/api/strategy/swap", swap)
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_SWAPPER"));
    }

    @Test
    @DisplayName("Read endpoints describe the deployment")
    void testReadEndpoints() throws Exception {
        mockMvc.perform(get("/api/vault/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settlementAsset").value("WETH"))
                .andExpect(jsonPath("$.lockPolicy").value("PER_HOLDER"));

        mockMvc.perform(get("/api/strategy/reserves"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reserves[0].asset").value("WETH"))
                .andExpect(jsonPath("$.reserves[1].asset").value("stWETH"));

        mockMvc.perform(get("/api/devnet/accounts/manager"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.address").value(Address.derive("manager").value()));

        mockMvc.perform(get("/api/vault/positions/not-an-address"))
                .andExpect(status().isBadRequest());
    }
}

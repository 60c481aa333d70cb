// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.devnet.SimulatedWorld;
import com.digitalasset.yieldvault.dto.FaucetRequest;
import com.digitalasset.yieldvault.util.Amounts;
import com.digitalasset.yieldvault.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DevNet helpers for driving the simulated world: test funds, account addresses and the clock.
 * Disabled with {@code yieldvault.simulation.devnet-endpoints=false}.
 */
@RestController
@RequestMapping("/api/devnet")
@ConditionalOnProperty(prefix = "yieldvault.simulation", name = "devnet-endpoints", havingValue = "true", matchIfMissing = true)
public class DevNetController {

    private final SimulatedWorld world;
    private final RequestValidator validator;

    public DevNetController(final SimulatedWorld world, final RequestValidator validator) {
        this.world = world;
        this.validator = validator;
    }

    /**
     * GET /api/devnet/accounts/{label} - the deterministic address of a named account
     */
    @GetMapping("/accounts/{label}")
    public ResponseEntity<Map<String, String>> account(@PathVariable("label") String label) {
        return ResponseEntity.ok(Map.of("label", label, "address", Address.derive(label).value()));
    }

    @PostMapping("/faucet")
    @WithSpan
    public ResponseEntity<?> faucet(@Valid @RequestBody FaucetRequest request) {
        Result<Address, DomainError> holder = validator.address(request.holder, "holder");
        if (holder.isErr()) {
            return DomainErrorStatusMapper.errorResponse(holder.getErrorUnsafe(), "/api/devnet/faucet");
        }
        Result<Asset, DomainError> asset = validator.asset(request.asset, "asset");
        if (asset.isErr()) {
            return DomainErrorStatusMapper.errorResponse(asset.getErrorUnsafe(), "/api/devnet/faucet");
        }
        Result<BigInteger, DomainError> amount = validator.amount(request.amount, "amount");
        if (amount.isErr()) {
            return DomainErrorStatusMapper.errorResponse(amount.getErrorUnsafe(), "/api/devnet/faucet");
        }
        world.faucet(holder.getValueUnsafe(), asset.getValueUnsafe(), amount.getValueUnsafe());

        Map<String, String> body = new LinkedHashMap<>();
        body.put("holder", holder.getValueUnsafe().value());
        body.put("asset", asset.getValueUnsafe().symbol());
        body.put("balance", Amounts.format(world.chain().balanceOf(asset.getValueUnsafe(), holder.getValueUnsafe())));
        return ResponseEntity.ok(body);
    }

    /**
     * POST /api/devnet/advance-time?seconds=N - moves the simulation clock forward
     */
    @PostMapping("/advance-time")
    public ResponseEntity<Map<String, String>> advanceTime(@RequestParam("seconds") long seconds) {
        if (seconds < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "seconds must not be negative"));
        }
        world.advanceTime(Duration.ofSeconds(seconds));
        return ResponseEntity.ok(Map.of("now", world.clock().instant().toString()));
    }
}

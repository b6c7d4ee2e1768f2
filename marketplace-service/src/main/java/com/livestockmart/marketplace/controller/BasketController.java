package com.livestockmart.marketplace.controller;

import com.livestockmart.marketplace.dto.BasketItemRequest;
import com.livestockmart.marketplace.dto.BasketItemResponse;
import com.livestockmart.marketplace.service.BasketService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/basket")
@RequiredArgsConstructor
@Validated
public class BasketController {

    private final BasketService basketService;

    @GetMapping
    public ResponseEntity<List<BasketItemResponse>> getBasket(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(basketService.getBasket(UUID.fromString(jwt.getSubject())));
    }

    @PutMapping
    public ResponseEntity<List<BasketItemResponse>> replaceBasket(
            @RequestBody List<@Valid BasketItemRequest> items,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(basketService.replaceBasket(UUID.fromString(jwt.getSubject()), items));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearBasket(@AuthenticationPrincipal Jwt jwt) {
        basketService.clearBasket(UUID.fromString(jwt.getSubject()));
        return ResponseEntity.noContent().build();
    }
}

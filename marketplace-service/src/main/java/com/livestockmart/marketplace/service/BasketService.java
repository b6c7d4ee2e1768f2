package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.BasketItemRequest;
import com.livestockmart.marketplace.dto.BasketItemResponse;

import java.util.List;
import java.util.UUID;

public interface BasketService {

    List<BasketItemResponse> getBasket(UUID userId);

    /**
     * Replaces the whole basket with the given lines. A listing may appear once.
     */
    List<BasketItemResponse> replaceBasket(UUID userId, List<BasketItemRequest> items);

    int clearBasket(UUID userId);
}

package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.BasketItemRequest;
import com.livestockmart.marketplace.dto.BasketItemResponse;
import com.livestockmart.marketplace.mapper.BasketMapper;
import com.livestockmart.marketplace.model.BasketItem;
import com.livestockmart.marketplace.repository.BasketItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BasketServiceImpl implements BasketService {

    private final BasketItemRepository basketItemRepository;
    private final BasketMapper basketMapper;

    @Override
    @Transactional(readOnly = true)
    public List<BasketItemResponse> getBasket(UUID userId) {
        return basketItemRepository.findByUserIdOrderByAddedAtAsc(userId).stream()
                .map(basketMapper::toBasketItemResponse)
                .toList();
    }

    @Override
    @Transactional
    public List<BasketItemResponse> replaceBasket(UUID userId, List<BasketItemRequest> items) {
        Set<UUID> seen = new HashSet<>();
        for (BasketItemRequest item : items) {
            if (!seen.add(item.getListingId())) {
                throw new IllegalArgumentException("Listing appears more than once in basket: " + item.getListingId());
            }
        }

        basketItemRepository.deleteAllByUserId(userId);
        List<BasketItem> entities = items.stream()
                .map(basketMapper::toBasketItem)
                .toList();
        entities.forEach(entity -> entity.setUserId(userId));
        List<BasketItem> saved = basketItemRepository.saveAll(entities);

        log.info("Basket replaced: userId={}, itemCount={}", userId, saved.size());
        return saved.stream()
                .map(basketMapper::toBasketItemResponse)
                .toList();
    }

    @Override
    @Transactional
    public int clearBasket(UUID userId) {
        int removed = basketItemRepository.deleteAllByUserId(userId);
        log.debug("Basket cleared: userId={}, removed={}", userId, removed);
        return removed;
    }
}

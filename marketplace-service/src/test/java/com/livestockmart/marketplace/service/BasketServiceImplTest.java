package com.livestockmart.marketplace.service;

import com.livestockmart.marketplace.dto.BasketItemRequest;
import com.livestockmart.marketplace.dto.BasketItemResponse;
import com.livestockmart.marketplace.mapper.BasketMapper;
import com.livestockmart.marketplace.model.BasketItem;
import com.livestockmart.marketplace.repository.BasketItemRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BasketServiceImplTest {

    @Mock
    private BasketItemRepository basketItemRepository;

    @Mock
    private BasketMapper basketMapper;

    @InjectMocks
    private BasketServiceImpl basketService;

    private BasketItemRequest item(UUID listingId) {
        BasketItemRequest request = new BasketItemRequest();
        request.setListingId(listingId);
        request.setName("Sahiwal cow");
        request.setPrice(new BigDecimal("900.00"));
        return request;
    }

    @Test
    @SuppressWarnings("unchecked")
    void replaceBasket_DeletesOldLinesAndStoresNewOnesForUser() {
        UUID userId = UUID.randomUUID();
        UUID listingId = UUID.randomUUID();
        when(basketMapper.toBasketItem(any())).thenAnswer(i -> BasketItem.builder()
                .listingId(((BasketItemRequest) i.getArgument(0)).getListingId())
                .build());
        when(basketItemRepository.saveAll(anyList())).thenAnswer(i -> i.getArgument(0));
        when(basketMapper.toBasketItemResponse(any())).thenReturn(BasketItemResponse.builder().build());

        List<BasketItemResponse> result = basketService.replaceBasket(userId, List.of(item(listingId)));

        assertThat(result).hasSize(1);
        InOrder inOrder = inOrder(basketItemRepository);
        inOrder.verify(basketItemRepository).deleteAllByUserId(userId);
        ArgumentCaptor<List<BasketItem>> captor = ArgumentCaptor.forClass(List.class);
        inOrder.verify(basketItemRepository).saveAll(captor.capture());
        assertThat(captor.getValue()).singleElement()
                .satisfies(saved -> assertThat(saved.getUserId()).isEqualTo(userId));
    }

    @Test
    void replaceBasket_DuplicateListing_Throws() {
        UUID listingId = UUID.randomUUID();

        assertThatThrownBy(() -> basketService.replaceBasket(UUID.randomUUID(), List.of(item(listingId), item(listingId))))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(basketItemRepository);
    }
}

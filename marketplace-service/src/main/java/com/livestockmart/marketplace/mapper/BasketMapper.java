package com.livestockmart.marketplace.mapper;

import com.livestockmart.marketplace.dto.BasketItemRequest;
import com.livestockmart.marketplace.dto.BasketItemResponse;
import com.livestockmart.marketplace.model.BasketItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface BasketMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "userId", ignore = true)
    @Mapping(target = "addedAt", ignore = true)
    @Mapping(target = "selected", source = "selected", defaultValue = "true")
    BasketItem toBasketItem(BasketItemRequest request);

    BasketItemResponse toBasketItemResponse(BasketItem basketItem);
}
